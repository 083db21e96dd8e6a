package Common;

/**
 * Decodifica una riga di protocollo in una {@link Request}.
 * Ogni comando ha una forma esatta; qualsiasi riga che non corrisponde
 * viene rifiutata con {@link ProtocolException}, senza interpretazioni parziali.
 *
 * Il token non viene validato qui: il parser si limita a estrarlo,
 * il controllo sull'insieme dei token accettati spetta a chi riceve la richiesta.
 */
public final class RequestParser {

    private RequestParser() {
    }

    public static Request parse(String line) throws ProtocolException {
        if (line == null || line.isBlank()) {
            throw new ProtocolException(Protocol.BAD_REQUEST, "Riga vuota");
        }
        String trimmed = line.trim();
        String command = trimmed.split("\\s+", 2)[0];

        switch (command) {
            case Protocol.ADD -> {
                // ADD <id> <host> <port> <token> <titolo...>
                String[] tokens = trimmed.split("\\s+", 6);
                if (tokens.length != 6) {
                    throw new ProtocolException(Protocol.BAD_REQUEST, "Numero di argomenti errato per ADD");
                }
                int id = parseNumber(tokens[1], "id");
                int port = parseNumber(tokens[3], "porta");
                PeerAddress address;
                try {
                    address = new PeerAddress(tokens[2], port);
                } catch (IllegalArgumentException ex) {
                    throw new ProtocolException(Protocol.BAD_REQUEST, ex.getMessage());
                }
                return new AddRequest(id, tokens[5].trim(), address, tokens[4]);
            }
            case Protocol.LOOKUP -> {
                String[] tokens = exactly(trimmed, 3, command);
                return new LookupRequest(parseNumber(tokens[1], "id"), tokens[2]);
            }
            case Protocol.LIST -> {
                String[] tokens = exactly(trimmed, 2, command);
                return new ListRequest(tokens[1]);
            }
            case Protocol.GET -> {
                String[] tokens = exactly(trimmed, 3, command);
                return new GetRequest(parseNumber(tokens[1], "id"), tokens[2]);
            }
            default -> throw new ProtocolException(Protocol.UNKNOWN_COMMAND, "Comando sconosciuto: " + command);
        }
    }

    private static String[] exactly(String line, int count, String command) throws ProtocolException {
        String[] tokens = line.split("\\s+");
        if (tokens.length != count) {
            throw new ProtocolException(Protocol.BAD_REQUEST, "Numero di argomenti errato per " + command);
        }
        return tokens;
    }

    private static int parseNumber(String value, String field) throws ProtocolException {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new ProtocolException(Protocol.BAD_REQUEST, "Valore non numerico per " + field + ": " + value);
        }
    }
}
