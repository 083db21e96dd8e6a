package Common;

/**
 * Richiesta decodificata da una riga del protocollo.
 * Esiste una sottoclasse per ogni comando: {@link AddRequest}, {@link LookupRequest},
 * {@link ListRequest} (verso l'Index Server) e {@link GetRequest} (verso un peer).
 */
public abstract class Request {

    private final String token;

    protected Request(String token) {
        this.token = token;
    }

    /** ritorna Nome del comando, una delle costanti di {@link Protocol} */
    public abstract String getCommand();

    /** Codifica la richiesta come riga di protocollo, senza terminatore */
    public abstract String toWire();

    /** ritorna Token del dialetto dichiarato dal mittente */
    public String getToken() {
        return token;
    }

    @Override
    public String toString() {
        return toWire();
    }
}
