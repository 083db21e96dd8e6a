/*
 * Classe che rappresenta la comunicazione tra il Peer e l'Index Server.
 * Si occupa di:
 * - Creare un socket per connettersi all'Index Server (una connessione per comando)
 * - Inviare le richieste ADD, LOOKUP, LIST
 * - Ricevere e interpretare le risposte
 * - Chiudere automaticamente la connessione al termine
 */
package Peer.client;

import Common.AddRequest;
import Common.DocumentSummary;
import Common.ListRequest;
import Common.Logger;
import Common.LookupRequest;
import Common.NotFoundException;
import Common.PeerAddress;
import Common.Protocol;
import Common.ProtocolException;
import Common.Request;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class IndexClient {
    private final String serverAddress;
    private final int serverPort;

    public IndexClient(String serverAddress, int serverPort) {
        this.serverAddress = serverAddress;
        this.serverPort = serverPort;
    }

    /**
     * Registra questo peer come possessore del documento.
     * @throws ProtocolException se il server risponde ERROR (es. INVALID_ID, UNSUPPORTED_PROTOCOL)
     * @throws IOException se la connessione fallisce o si interrompe
     */
    public void add(int id, String title, PeerAddress self, String token) throws IOException, ProtocolException {
        AddRequest request = new AddRequest(id, title, self, token);
        try (Socket socket = connect()) {
            BufferedReader in = send(socket, request);
            String rest = readStatus(in, request);
            if (!rest.isEmpty()) {
                throw badResponse(request, Protocol.OK + " " + rest);
            }
            Logger.info("Documento " + id + " registrato presso l'Index Server come " + self);
        }
    }

    /**
     * Chiede all'Index Server i possessori del documento, nell'ordine fornito dal server.
     * @throws NotFoundException se il documento non è mai stato registrato
     */
    public List<PeerAddress> lookup(int id, String token) throws IOException, ProtocolException {
        LookupRequest request = new LookupRequest(id, token);
        try (Socket socket = connect()) {
            BufferedReader in = send(socket, request);
            int count = parseCount(readStatus(in, request), request);
            List<PeerAddress> holders = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String line = readLine(in, request);
                String[] parts = line.trim().split("\\s+");
                if (parts.length != 2) {
                    throw badResponse(request, line);
                }
                try {
                    holders.add(new PeerAddress(parts[0], Integer.parseInt(parts[1])));
                } catch (IllegalArgumentException ex) {
                    throw badResponse(request, line);
                }
            }
            return holders;
        }
    }

    /** Richiede l'indice completo, ordinato per id crescente. */
    public List<DocumentSummary> list(String token) throws IOException, ProtocolException {
        ListRequest request = new ListRequest(token);
        try (Socket socket = connect()) {
            BufferedReader in = send(socket, request);
            int count = parseCount(readStatus(in, request), request);
            List<DocumentSummary> documents = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String line = readLine(in, request);
                String[] parts = line.trim().split("\\s+", 2);
                if (parts.length != 2) {
                    throw badResponse(request, line);
                }
                try {
                    documents.add(new DocumentSummary(Integer.parseInt(parts[0]), parts[1]));
                } catch (NumberFormatException ex) {
                    throw badResponse(request, line);
                }
            }
            return documents;
        }
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket(serverAddress, serverPort);
        socket.setSoTimeout(Protocol.IDLE_TIMEOUT_MS);
        return socket;
    }

    private BufferedReader send(Socket socket, Request request) throws IOException {
        BufferedWriter out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        out.write(request.toWire());
        out.write(Protocol.CRLF);
        out.flush();
        return new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
    }

    // Legge la riga di stato: ritorna quanto segue "OK", lancia un'eccezione per "ERROR <motivo>"
    private String readStatus(BufferedReader in, Request request) throws IOException, ProtocolException {
        String status = readLine(in, request);
        if (status.equals(Protocol.OK) || status.startsWith(Protocol.OK + " ")) {
            return status.substring(Protocol.OK.length()).trim();
        }
        if (status.startsWith(Protocol.ERROR + " ")) {
            String reason = status.substring(Protocol.ERROR.length()).trim();
            if (Protocol.NOT_FOUND.equals(reason)) {
                throw new NotFoundException("Documento non trovato dall'Index Server (" + request.getCommand() + ")");
            }
            throw new ProtocolException(reason, "L'Index Server ha rifiutato " + request.getCommand() + ": " + reason);
        }
        throw badResponse(request, status);
    }

    private String readLine(BufferedReader in, Request request) throws IOException {
        String line = in.readLine();
        if (line == null) {
            throw new IOException("Connessione chiusa dall'Index Server durante " + request.getCommand());
        }
        return line;
    }

    private int parseCount(String value, Request request) throws ProtocolException {
        try {
            int count = Integer.parseInt(value);
            if (count < 0) {
                throw badResponse(request, value);
            }
            return count;
        } catch (NumberFormatException ex) {
            throw badResponse(request, value);
        }
    }

    private ProtocolException badResponse(Request request, String response) {
        return new ProtocolException(Protocol.BAD_RESPONSE,
                "Risposta non valida dall'Index Server a " + request.getCommand() + ": " + response);
    }
}
