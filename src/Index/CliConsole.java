package Index;

import Common.DocumentSummary;
import Common.PeerAddress;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Console interattiva dell'operatore dell'Index Server.
 * I comandi leggono l'indice tramite DirectoryStore e non bloccano il servizio di rete.
 */
class CliConsole implements Runnable {

    private static final String USAGE = "Comando sconosciuto. Uso: list | lookup <id> | quit";

    private final IndexServer server;
    private final BufferedReader console;
    private final PrintStream out;

    CliConsole(IndexServer server, BufferedReader console, PrintStream out) {
        this.server = server;
        this.console = console;
        this.out = out;
    }

    @Override
    public void run() {
        try {
            String line;
            while ((line = console.readLine()) != null) {
                if (!execute(line)) {
                    return;
                }
            }
        } catch (IOException e) {
            out.println("Errore console: " + e.getMessage());
        }
    }

    // false quando l'operatore chiede di terminare
    boolean execute(String line) {
        String[] tokens = line.trim().split("\\s+");
        switch (tokens[0]) {
            case "" -> { }
            case "list" -> handleList();
            case "lookup" -> handleLookup(tokens);
            case "quit" -> {
                out.println("Index Server terminato.");
                server.shutdown();
                return false;
            }
            default -> out.println(USAGE);
        }
        return true;
    }

    private void handleList() {
        List<DocumentSummary> all = server.getStore().snapshot();
        out.println("Documenti indicizzati: " + all.size());
        for (DocumentSummary entry : all) {
            out.printf("- %d %s%n", entry.getId(), entry.getTitle());
        }
    }

    private void handleLookup(String[] tokens) {
        if (tokens.length != 2) {
            out.println("Uso: lookup <id>");
            return;
        }
        int id;
        try {
            id = Integer.parseInt(tokens[1]);
        } catch (NumberFormatException ex) {
            out.println("Id non valido: " + tokens[1]);
            return;
        }
        List<PeerAddress> holders = server.getStore().find(id);
        if (holders.isEmpty()) {
            out.println("Nessun peer possiede il documento: " + id);
        } else {
            out.printf("Documento %d '%s' posseduto da: %s%n", id, server.getStore().titleOf(id), holders);
        }
    }
}
