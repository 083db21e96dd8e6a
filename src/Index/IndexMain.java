package Index;

import Common.Logger;
import Common.Protocol;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Classe di entry-point che avvia l'Index Server.
 * Uso: java Index.IndexMain [porta]   (default 7734)
 */
public class IndexMain {

    public static void main(String[] args) {
        if (args.length > 1) {
            System.err.println("Uso: java Index.IndexMain [porta]");
            System.exit(1);
        }
        int port = Protocol.DEFAULT_SERVER_PORT;
        if (args.length == 1) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException ex) {
                System.err.println("Porta non valida: " + args[0]);
                System.exit(1);
                return;
            }
        }

        IndexServer server = new IndexServer(port, Protocol.DEFAULT_TOKENS);
        try {
            server.start();
        } catch (IOException e) {
            Logger.error("Impossibile avviare l'Index Server sulla porta " + port + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        // Console su thread daemon: se stdin si chiude il server continua a servire
        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        Thread cliThread = new Thread(new CliConsole(server, console, System.out), "index-console");
        cliThread.setDaemon(true);
        cliThread.start();

        try {
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.shutdown();
        }
    }
}
