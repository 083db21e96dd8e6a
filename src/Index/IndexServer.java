package Index;

import Common.Logger;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Gestisce il ServerSocket dell'Index Server e il thread-pool per le connessioni dei peer.
 * Ogni connessione accettata viene servita da un IndexRequestHandler in un thread del pool,
 * quindi i peer sono gestiti in modo concorrente e indipendente.
 * Metodi start() e shutdown() synchronized per evitare race conditions nella fase di avvio/arresto.
 */
public class IndexServer {

    // pausa dopo un errore di accept, per non girare a vuoto
    private static final long ACCEPT_RETRY_MS = 100;

    private final int port;
    private final Set<String> acceptedTokens;
    // indice condiviso da tutte le connessioni
    private final DirectoryStore store = new DirectoryStore();
    // thread pool dinamico, un thread per connessione attiva
    private final ExecutorService pool = Executors.newCachedThreadPool();
    private volatile boolean running = false;
    private ServerSocket serverSocket;
    private Thread acceptor;

    public IndexServer(int port, Set<String> acceptedTokens) {
        this.port = port;
        this.acceptedTokens = Set.copyOf(acceptedTokens);
    }

    /**
     * Apre il ServerSocket e avvia il thread che accetta le connessioni.
     * Con porta 0 il sistema sceglie una porta libera, leggibile poi con {@link #getPort()}.
     */
    public synchronized void start() throws IOException {
        // Evita avvii multipli se il server è già attivo.
        if (running)
            return;
        serverSocket = new ServerSocket(port);
        running = true;
        acceptor = new Thread(this::acceptLoop, "index-acceptor");
        acceptor.start();
        Logger.info("[INDEX] In ascolto sulla porta " + serverSocket.getLocalPort());
    }

    // ogni nuova connessione crea un nuovo IndexRequestHandler eseguito nel pool.
    // Un errore di accept (es. troppi file aperti) non ferma il server: si riprova dopo una breve pausa.
    private void acceptLoop() {
        while (running) {
            Socket clientSocket;
            try {
                clientSocket = serverSocket.accept();
            } catch (IOException e) {
                // Mostra l'errore solo se il server era in esecuzione
                if (running) {
                    Logger.error("[INDEX] Errore in accept: " + e.getMessage());
                    pause();
                }
                continue;
            }
            Logger.info("[INDEX] Connessione ricevuta da " + clientSocket.getRemoteSocketAddress());
            dispatch(clientSocket);
        }
        Logger.info("[INDEX] Server terminato.");
    }

    // Affida la connessione al pool; se il pool è già fermo la connessione viene chiusa
    void dispatch(Socket clientSocket) {
        try {
            pool.execute(new IndexRequestHandler(clientSocket, store, acceptedTokens));
        } catch (RejectedExecutionException e) {
            Logger.warn("[INDEX] Server in chiusura, connessione rifiutata: " + clientSocket.getRemoteSocketAddress());
            try {
                clientSocket.close();
            } catch (IOException ex) {
                Logger.error("[INDEX] Errore chiusura socket: " + ex.getMessage());
            }
        }
    }

    private void pause() {
        try {
            TimeUnit.MILLISECONDS.sleep(ACCEPT_RETRY_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    /** Arresta il server chiudendo il socket e fermando il pool di thread. */
    public synchronized void shutdown() {
        if (!running)
            return;
        running = false;
        try {
            if (serverSocket != null && !serverSocket.isClosed()) {
                serverSocket.close();
            }
        } catch (IOException e) {
            Logger.error("[INDEX] Errore chiusura server: " + e.getMessage());
        }
        pool.shutdownNow();
    }

    /** Attende la terminazione del thread di accept. */
    public void awaitTermination() throws InterruptedException {
        Thread t;
        synchronized (this) {
            t = acceptor;
        }
        if (t != null) {
            t.join();
        }
    }

    /** ritorna porta effettiva di ascolto (-1 se non avviato) */
    public synchronized int getPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    public boolean isRunning() {
        return running;
    }

    /** ritorna Stato interno per la CLI */
    public DirectoryStore getStore() {
        return store;
    }
}
