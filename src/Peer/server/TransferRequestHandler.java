package Peer.server;

import Common.GetRequest;
import Common.Logger;
import Common.Protocol;
import Common.ProtocolException;
import Common.Request;
import Common.RequestParser;
import Peer.utils.LocalStore;
import java.io.*;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.Set;

/**
 * Gestisce una singola richiesta GET arrivata da un altro peer.
 * Risposta: "OK <lunghezza>" seguito dai byte del documento, oppure "ERROR <motivo>";
 * in entrambi i casi la connessione viene chiusa subito dopo.
 */
public class TransferRequestHandler implements Runnable {

    private final Socket clientSocket;
    private final LocalStore store;
    private final Set<String> acceptedTokens;

    public TransferRequestHandler(Socket clientSocket, LocalStore store, Set<String> acceptedTokens) {
        this.clientSocket = clientSocket;
        this.store = store;
        this.acceptedTokens = acceptedTokens;
    }

    @Override
    public void run() {
        String remote = String.valueOf(clientSocket.getRemoteSocketAddress());
        try {
            clientSocket.setSoTimeout(Protocol.IDLE_TIMEOUT_MS);
            BufferedReader in = new BufferedReader(new InputStreamReader(clientSocket.getInputStream(), StandardCharsets.UTF_8));
            OutputStream out = new BufferedOutputStream(clientSocket.getOutputStream());

            String line = in.readLine();
            Logger.info("[TRANSFER] Ricevuta richiesta da " + remote + ": " + line);
            try {
                GetRequest request = decode(line);
                byte[] content = readDocument(request.getId());
                out.write((Protocol.OK + " " + content.length + Protocol.CRLF).getBytes(StandardCharsets.UTF_8));
                out.write(content);
                out.flush();
                Logger.info("[TRANSFER] Documento " + request.getId() + " inviato a " + remote + " (" + content.length + " byte)");
            } catch (ProtocolException ex) {
                Logger.warn("[TRANSFER] Richiesta rifiutata da " + remote + ": " + ex.getMessage());
                out.write((Protocol.ERROR + " " + ex.getReason() + Protocol.CRLF).getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        } catch (IOException e) {
            Logger.error("[TRANSFER] Errore I/O con " + remote + ": " + e.getMessage());
        } finally {
            try {
                clientSocket.close();
            } catch (IOException e) {
                Logger.error("[TRANSFER] Errore chiusura socket: " + e.getMessage());
            }
        }
    }

    private GetRequest decode(String line) throws ProtocolException {
        if (line == null) {
            throw new ProtocolException(Protocol.BAD_REQUEST, "Connessione chiusa prima della richiesta");
        }
        Request request = RequestParser.parse(line);
        if (!(request instanceof GetRequest)) {
            throw new ProtocolException(Protocol.UNKNOWN_COMMAND, "Comando non gestito da un peer: " + request.getCommand());
        }
        if (!acceptedTokens.contains(request.getToken())) {
            throw new ProtocolException(Protocol.UNSUPPORTED_PROTOCOL, "Token non accettato: " + request.getToken());
        }
        return (GetRequest) request;
    }

    // Il peer può essere ancora elencato dall'indice pur avendo rimosso il file: risponde NOT_FOUND
    private byte[] readDocument(int id) throws ProtocolException {
        try {
            return store.read(id);
        } catch (NoSuchFileException ex) {
            throw new ProtocolException(Protocol.NOT_FOUND, "Documento " + id + " non presente localmente");
        } catch (IOException ex) {
            Logger.error("[TRANSFER] Lettura del documento " + id + " fallita: " + ex.getMessage());
            throw new ProtocolException(Protocol.INTERNAL_ERROR, "Lettura del documento " + id + " fallita");
        }
    }
}
