package Peer.server;
/**
 * Classe TransferListener
 *
 * Server TCP del peer: apre una porta e rimane in ascolto delle richieste GET
 * degli altri peer. Per ogni connessione accettata esegue un TransferRequestHandler
 * in un thread del pool, così più download in uscita procedono in parallelo
 * e il ciclo di accept non si blocca mai.
 *
 * Gira in un proprio thread, indipendente dalla console del peer:
 * i due ruoli condividono solo il LocalStore.
 */

import Common.Logger;
import Peer.utils.LocalStore;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

public class TransferListener {

    private static final long ACCEPT_RETRY_MS = 100;

    private final int port;
    private final LocalStore store;
    private final Set<String> acceptedTokens;
    private final ExecutorService pool = Executors.newCachedThreadPool();
    private volatile boolean running = false;
    private ServerSocket serverSocket;

    /**
     * port porta di ascolto, 0 per una porta effimera scelta dal sistema
     */
    public TransferListener(int port, LocalStore store, Set<String> acceptedTokens) {
        this.port = port;
        this.store = store;
        this.acceptedTokens = Set.copyOf(acceptedTokens);
    }

    /**
     * Apre il ServerSocket e avvia il thread di accept.
     * Al ritorno la porta è già aperta e {@link #getPort()} restituisce quella effettiva.
     */
    public synchronized void start() throws IOException {
        if (running)
            return;
        serverSocket = new ServerSocket(port);
        running = true;
        Thread acceptor = new Thread(this::acceptLoop, "transfer-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        Logger.info("[TRANSFER] Avviato sulla porta " + serverSocket.getLocalPort());
    }

    // Un errore di accept non chiude il listener: la porta resta quella pubblicizzata all'indice
    private void acceptLoop() {
        while (running) {
            Socket clientSocket;
            try {
                clientSocket = serverSocket.accept();
            } catch (IOException e) {
                if (running) {
                    Logger.error("[TRANSFER] Errore in accept: " + e.getMessage());
                    pause();
                }
                continue;
            }
            Logger.info("[TRANSFER] Connessione ricevuta da " + clientSocket.getRemoteSocketAddress());
            dispatch(clientSocket);
        }
        Logger.info("[TRANSFER] Server terminato.");
    }

    // Affida la connessione al pool; dopo stop() la connessione viene chiusa invece di restare appesa
    void dispatch(Socket clientSocket) {
        try {
            pool.execute(new TransferRequestHandler(clientSocket, store, acceptedTokens));
        } catch (RejectedExecutionException e) {
            Logger.warn("[TRANSFER] Listener in chiusura, connessione rifiutata: " + clientSocket.getRemoteSocketAddress());
            try {
                clientSocket.close();
            } catch (IOException ex) {
                Logger.error("[TRANSFER] Errore chiusura socket: " + ex.getMessage());
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

    /*
    * Ferma il server chiudendo il ServerSocket; i trasferimenti in corso terminano da soli
    */
    public synchronized void stop() {
        running = false;
        if (serverSocket != null && !serverSocket.isClosed()) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                Logger.error("[TRANSFER] Errore chiusura ServerSocket: " + e.getMessage());
            }
        }
        pool.shutdown();
    }

    /** ritorna porta effettiva di ascolto (-1 se non avviato) */
    public synchronized int getPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    public boolean isRunning() {
        return running;
    }
}
