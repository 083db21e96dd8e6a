package Peer.client;

import Common.GetRequest;
import Common.Logger;
import Common.NotFoundException;
import Common.PeerAddress;
import Common.Protocol;
import Common.ProtocolException;
import Peer.utils.LocalStore;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

// Client che si connette al Transfer Listener di un altro peer per scaricare un documento.
// I byte ricevuti finiscono nel LocalStore solo se il trasferimento è completo.
public class TransferClient {

    // Riga di stato più lunga accettata prima dei byte del documento
    private static final int MAX_STATUS_LENGTH = 256;

    // Legge una riga di testo dal BufferedInputStream, senza consumare i byte che seguono.
    // Ritorna null se il flusso termina senza dati.
    private String readLine(BufferedInputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int c;
        while ((c = in.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (line.size() >= MAX_STATUS_LENGTH) {
                throw new IOException("Riga di stato troppo lunga");
            }
            line.write(c);
        }
        if (c == -1 && line.size() == 0) {
            return null;
        }
        String text = line.toString(StandardCharsets.UTF_8);
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    /**
     * Scarica il documento dal peer indicato e lo pubblica nel LocalStore.
     *
     * @return numero di byte ricevuti
     * @throws NotFoundException se il peer non possiede (più) il documento
     * @throws ProtocolException per qualsiasi altra risposta ERROR o risposta non valida
     * @throws IOException se la connessione fallisce o si chiude prima della fine del documento
     */
    public long fetch(PeerAddress holder, int id, String token, LocalStore store) throws IOException, ProtocolException {
        GetRequest request = new GetRequest(id, token);
        try (Socket socket = new Socket(holder.getHost(), holder.getPort())) {
            socket.setSoTimeout(Protocol.IDLE_TIMEOUT_MS);
            OutputStream out = socket.getOutputStream();
            BufferedInputStream in = new BufferedInputStream(socket.getInputStream());

            // 1. Invia la richiesta
            out.write((request.toWire() + Protocol.CRLF).getBytes(StandardCharsets.UTF_8));
            out.flush();

            // 2. Attende la riga di stato
            String status = readLine(in);
            if (status == null) {
                throw new IOException("Connessione chiusa da " + holder + " senza risposta");
            }
            if (status.startsWith(Protocol.OK + " ")) {
                long length = parseLength(status, holder);
                Logger.info("Download del documento " + id + " avviato da " + holder + " (" + length + " byte)");
                // 3. I byte seguono fino alla chiusura della connessione
                long received = store.publish(id, in, length);
                Logger.info("Download completato. Ricevuti " + received + " byte.");
                return received;
            }
            if (status.startsWith(Protocol.ERROR + " ")) {
                String reason = status.substring(Protocol.ERROR.length()).trim();
                Logger.warn("Download del documento " + id + " rifiutato da " + holder + ": " + reason);
                if (Protocol.NOT_FOUND.equals(reason)) {
                    throw new NotFoundException("Il peer " + holder + " non possiede il documento " + id);
                }
                throw new ProtocolException(reason, "Il peer " + holder + " ha rifiutato GET " + id + ": " + reason);
            }
            throw new ProtocolException(Protocol.BAD_RESPONSE, "Risposta non riconosciuta da " + holder + ": " + status);
        }
    }

    private long parseLength(String status, PeerAddress holder) throws ProtocolException {
        String value = status.substring(Protocol.OK.length()).trim();
        try {
            long length = Long.parseLong(value);
            if (length < 0) {
                throw new NumberFormatException(value);
            }
            return length;
        } catch (NumberFormatException ex) {
            throw new ProtocolException(Protocol.BAD_RESPONSE, "Lunghezza non valida da " + holder + ": " + status);
        }
    }
}
