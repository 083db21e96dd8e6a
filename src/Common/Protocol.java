package Common;
/*
 * Classe Protocol per standardizzare i messaggi tra Peer e Index Server e tra Peer e Peer.
 * Contiene le costanti per i comandi, le risposte e i motivi di errore
 * utilizzati sul filo, oltre ai valori di default condivisi dai due processi.
 */

import java.util.Set;

public final class Protocol {

    private Protocol() {
    }

    // Dialetto accettato di default da server e peer
    public static final String VERSION = "P2P-CI/1.0";
    public static final Set<String> DEFAULT_TOKENS = Set.of(VERSION);

    // Porta ben nota dell'Index Server
    public static final int DEFAULT_SERVER_PORT = 7734;
    // Durata massima di una connessione inattiva (ms)
    public static final int IDLE_TIMEOUT_MS = 60_000;
    public static final String CRLF = "\r\n";

    // Da Peer a Index Server
    public static final String ADD = "ADD"; // Peer dichiara di possedere un documento
    public static final String LOOKUP = "LOOKUP"; // Richiesta dei peer che possiedono un documento
    public static final String LIST = "LIST"; // Richiesta dell'indice completo

    // Da Peer a Peer
    public static final String GET = "GET"; // Richiesta dei byte di un documento

    // Risposte
    public static final String OK = "OK";
    public static final String ERROR = "ERROR";

    // Motivi di errore (seguono ERROR)
    public static final String BAD_REQUEST = "BAD_REQUEST"; // riga non interpretabile
    public static final String UNKNOWN_COMMAND = "UNKNOWN_COMMAND"; // comando sconosciuto
    public static final String UNSUPPORTED_PROTOCOL = "UNSUPPORTED_PROTOCOL"; // token non accettato
    public static final String INVALID_ID = "INVALID_ID"; // id non positivo
    public static final String NOT_FOUND = "NOT_FOUND"; // documento sconosciuto
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR"; // il peer non riesce a leggere il proprio file
    public static final String BAD_RESPONSE = "BAD_RESPONSE"; // solo lato client: risposta non interpretabile

    // Nome del file locale che contiene il documento con l'id dato
    public static String fileNameFor(int id) {
        return "rfc" + id + ".txt";
    }
}
