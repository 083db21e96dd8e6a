package Common;

/**
 * Errore di protocollo: richiesta non interpretabile, comando sconosciuto,
 * token non accettato o risposta ERROR ricevuta dall'altra parte.
 * Il motivo è uno dei codici definiti in {@link Protocol}.
 */
public class ProtocolException extends Exception {

    private final String reason;

    public ProtocolException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ProtocolException(String reason) {
        this(reason, reason);
    }

    /** ritorna Codice del motivo, usato nella riga "ERROR <motivo>" */
    public String getReason() {
        return reason;
    }
}
