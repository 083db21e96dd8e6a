package Common;

/**
 * Documento sconosciuto all'Index Server (LOOKUP) o assente dal peer interrogato (GET).
 */
public class NotFoundException extends ProtocolException {

    public NotFoundException(String message) {
        super(Protocol.NOT_FOUND, message);
    }
}
