package Index;

import Common.AddRequest;
import Common.DocumentSummary;
import Common.Logger;
import Common.LookupRequest;
import Common.PeerAddress;
import Common.Protocol;
import Common.ProtocolException;
import Common.Request;
import Common.RequestParser;
import java.io.*;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

/**
 * Ogni istanza gestisce una singola connessione di controllo verso l'Index Server,
 * processa le righe che il peer invia tramite socket (ADD / LOOKUP / LIST).
 * Ogni riga riceve esattamente una risposta; un errore su una riga produce
 * "ERROR <motivo>" su questa connessione e non tocca le altre.
 */
class IndexRequestHandler implements Runnable {

    // connessione con un peer
    private final Socket socket;
    // indice condiviso
    private final DirectoryStore store;
    private final Set<String> acceptedTokens;
    private BufferedReader in;
    private BufferedWriter out;

    IndexRequestHandler(Socket socket, DirectoryStore store, Set<String> acceptedTokens) {
        this.socket = socket;
        this.store = store;
        this.acceptedTokens = acceptedTokens;
    }

    @Override
    public void run() {
        String remote = String.valueOf(socket.getRemoteSocketAddress());
        try {
            socket.setSoTimeout(Protocol.IDLE_TIMEOUT_MS);
            in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));

            // Ciclo che ascolta le richieste inviate dal peer riga per riga
            String line;
            while ((line = in.readLine()) != null) {
                // anche una riga vuota riceve risposta (ERROR BAD_REQUEST dal parser)
                Logger.info("[INDEX] " + remote + " -> " + line);
                try {
                    handle(RequestParser.parse(line));
                } catch (ProtocolException ex) {
                    Logger.warn("[INDEX] Richiesta rifiutata da " + remote + ": " + ex.getMessage());
                    sendResponse(Protocol.ERROR + " " + ex.getReason());
                }
            }
        } catch (IOException e) {
            Logger.warn("[INDEX] Connessione con " + remote + " interrotta: " + e.getMessage());
        } finally {
            cleanup();
        }
    }

    private void handle(Request request) throws IOException, ProtocolException {
        if (!acceptedTokens.contains(request.getToken())) {
            throw new ProtocolException(Protocol.UNSUPPORTED_PROTOCOL, "Token non accettato: " + request.getToken());
        }
        switch (request.getCommand()) {
            case Protocol.ADD -> handleAdd((AddRequest) request);
            case Protocol.LOOKUP -> handleLookup((LookupRequest) request);
            case Protocol.LIST -> handleList();
            // GET è un comando valido solo verso un peer
            default -> throw new ProtocolException(Protocol.UNKNOWN_COMMAND, "Comando non gestito dall'Index Server: " + request.getCommand());
        }
    }

    /**
     * Gestisce il comando ADD.
     * Sintassi: ADD <id> <host> <port> <token> <titolo...>
     */
    private void handleAdd(AddRequest request) throws IOException, ProtocolException {
        boolean added;
        try {
            added = store.register(request.getId(), request.getTitle(), request.getAddress());
        } catch (IllegalArgumentException ex) {
            throw new ProtocolException(request.getId() <= 0 ? Protocol.INVALID_ID : Protocol.BAD_REQUEST, ex.getMessage());
        }
        if (added) {
            Logger.info("[INDEX] Documento " + request.getId() + " registrato per " + request.getAddress());
        }
        sendResponse(Protocol.OK);
    }

    /**
     * Gestisce il comando LOOKUP.
     * Risposta: OK <n> seguito da n righe "<host> <port>", oppure ERROR NOT_FOUND
     */
    private void handleLookup(LookupRequest request) throws IOException, ProtocolException {
        List<PeerAddress> holders = store.find(request.getId());
        if (holders.isEmpty()) {
            throw new ProtocolException(Protocol.NOT_FOUND, "Documento sconosciuto: " + request.getId());
        }
        StringBuilder sb = new StringBuilder();
        sb.append(Protocol.OK).append(" ").append(holders.size());
        for (PeerAddress holder : holders) {
            sb.append(Protocol.CRLF).append(holder.toWire());
        }
        sendResponse(sb.toString());
    }

    /**
     * Gestisce il comando LIST.
     * Risposta: OK <n> seguito da n righe "<id> <titolo>" in ordine di id crescente
     */
    private void handleList() throws IOException {
        List<DocumentSummary> all = store.snapshot();
        StringBuilder sb = new StringBuilder();
        sb.append(Protocol.OK).append(" ").append(all.size());
        for (DocumentSummary entry : all) {
            sb.append(Protocol.CRLF).append(entry.getId()).append(" ").append(entry.getTitle());
        }
        sendResponse(sb.toString());
    }

    private void sendResponse(String msg) throws IOException {
        out.write(msg);
        out.write(Protocol.CRLF);
        out.flush();
    }

    private void cleanup() {
        try {
            socket.close();
        } catch (IOException e) {
            Logger.error("[INDEX] Errore chiusura socket: " + e.getMessage());
        }
    }
}
