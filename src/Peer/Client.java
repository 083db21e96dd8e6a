package Peer;

import Common.Logger;
import Common.PeerAddress;
import Common.Protocol;
import Peer.client.IndexClient;
import Peer.client.TransferClient;
import Peer.server.TransferListener;
import Peer.utils.LocalStore;

import java.io.*;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Entry-point del peer.
 * Uso: java Peer.Client [serverHost] [serverPort] [cartellaDocumenti] [hostPubblicizzato]
 *
 * Il peer avvia prima il proprio Transfer Listener su una porta effimera, poi registra
 * i documenti già presenti nella cartella e infine passa alla console interattiva.
 * Listener e console girano su thread distinti e condividono solo il LocalStore.
 */
public class Client {
    public static void main(String[] args) {
        if (args.length > 4) {
            Logger.error("Utilizzo corretto: java Peer.Client [serverHost] [serverPort] [cartellaDocumenti] [hostPubblicizzato]");
            return;
        }

        String serverHost = args.length > 0 ? args[0] : "localhost";
        int serverPort = Protocol.DEFAULT_SERVER_PORT;
        if (args.length > 1) {
            try {
                serverPort = Integer.parseInt(args[1]);
            } catch (NumberFormatException ex) {
                Logger.error("Porta del server non valida: " + args[1]);
                return;
            }
        }
        Path documentDir = Path.of(args.length > 2 ? args[2] : "rfcs").toAbsolutePath();
        String advertisedHost;
        try {
            advertisedHost = args.length > 3 ? args[3] : InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            Logger.warn("Impossibile determinare l'indirizzo locale, uso 127.0.0.1: " + e.getMessage());
            advertisedHost = "127.0.0.1";
        }

        LocalStore store = new LocalStore(documentDir);

        // 1. Transfer Listener su porta effimera
        TransferListener listener = new TransferListener(0, store, Protocol.DEFAULT_TOKENS);
        try {
            listener.start();
        } catch (IOException e) {
            Logger.error("Impossibile avviare il Transfer Listener: " + e.getMessage());
            return;
        }

        PeerAddress self;
        try {
            self = new PeerAddress(advertisedHost, listener.getPort());
        } catch (IllegalArgumentException e) {
            Logger.error(e.getMessage());
            listener.stop();
            return;
        }
        Logger.info("Peer inizializzato come " + self + " con cartella: " + documentDir);

        PeerAgent agent = new PeerAgent(self, store, new IndexClient(serverHost, serverPort), new TransferClient());

        // 2. Registrazione dei documenti già presenti
        try {
            int registered = agent.registerLocalDocuments(Protocol.VERSION);
            Logger.info("Documenti locali registrati: " + registered);
        } catch (IOException e) {
            Logger.error("Registrazione dei documenti locali fallita: " + e.getMessage());
        }

        // 3. Interazione con comandi
        PeerConsole console = new PeerConsole(agent, System.out);
        try {
            console.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            Logger.error("Errore console: " + e.getMessage());
        } finally {
            listener.stop();
            Logger.warn("Peer terminato.");
        }
    }
}
