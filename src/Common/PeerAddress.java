package Common;

import java.util.Objects;

/**
 * Oggetto immutabile che descrive dove raggiungere il Transfer Listener di un peer.
 * L'indirizzo è quello dichiarato dal peer stesso nella richiesta ADD,
 * non quello da cui arriva la connessione verso l'Index Server.
 */
public class PeerAddress {
    private final String host;
    private final int port;

    /**
     * host nome o IP pubblicizzato dal peer (non vuoto, senza spazi)
     * port porta del Transfer Listener (1..65535)
     */
    public PeerAddress(String host, int port) {
        if (host == null || host.isBlank() || host.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Host non valido: '" + host + "'");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Porta non valida: " + port);
        }
        this.host = host;
        this.port = port;
    }

    /** ritorna Host del peer */
    public String getHost() {
        return host;
    }

    /** ritorna Porta del Transfer Listener */
    public int getPort() {
        return port;
    }

    /** Forma usata sul filo: "<host> <port>" */
    public String toWire() {
        return host + " " + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerAddress)) return false;
        PeerAddress other = (PeerAddress) o;
        return port == other.port && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
