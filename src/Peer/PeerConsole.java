package Peer;

import Common.DocumentSummary;
import Common.PeerAddress;
import Common.ProtocolException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Interprete dei comandi interattivi del peer:
 * add &lt;id&gt; &lt;token&gt; | lookup &lt;id&gt; &lt;token&gt; | list &lt;token&gt; | get &lt;id&gt; &lt;token&gt; | local | quit
 *
 * Ogni comando produce un risultato o un messaggio di errore esplicito;
 * un comando fallito non interrompe il ciclo.
 */
public class PeerConsole {

    private static final String USAGE =
            "Uso: add <id> <token> | lookup <id> <token> | list <token> | get <id> <token> | local | quit";

    private final PeerAgent agent;
    private final PrintStream out;

    public PeerConsole(PeerAgent agent, PrintStream out) {
        this.agent = agent;
        this.out = out;
    }

    // Legge comandi finché arriva "quit" o lo stream termina
    public void run(BufferedReader in) throws IOException {
        out.print("> ");
        out.flush();
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line)) {
                return;
            }
            out.print("> ");
            out.flush();
        }
    }

    /**
     * Esegue un singolo comando.
     * @return false se il comando era quit
     */
    public boolean execute(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts[0].isEmpty()) {
            return true;
        }
        try {
            switch (parts[0]) {
                case "add" -> {
                    if (parts.length != 3) {
                        out.println("Uso: add <id> <token>");
                        break;
                    }
                    int id = parseId(parts[1]);
                    String title = agent.add(id, parts[2]);
                    out.println("OK documento " + id + " '" + title + "' registrato come " + agent.getSelf());
                }
                case "lookup" -> {
                    if (parts.length != 3) {
                        out.println("Uso: lookup <id> <token>");
                        break;
                    }
                    int id = parseId(parts[1]);
                    List<PeerAddress> holders = agent.lookup(id, parts[2]);
                    out.println("Documento " + id + " posseduto da " + holders.size() + " peer:");
                    for (PeerAddress holder : holders) {
                        out.println(holder.toWire());
                    }
                }
                case "list" -> {
                    if (parts.length != 2) {
                        out.println("Uso: list <token>");
                        break;
                    }
                    List<DocumentSummary> documents = agent.list(parts[1]);
                    out.println("Documenti in rete: " + documents.size());
                    for (DocumentSummary document : documents) {
                        out.println(document.getId() + " " + document.getTitle());
                    }
                }
                case "get" -> {
                    if (parts.length != 3) {
                        out.println("Uso: get <id> <token>");
                        break;
                    }
                    int id = parseId(parts[1]);
                    PeerAddress source = agent.get(id, parts[2]);
                    out.println("OK documento " + id + " scaricato da " + source);
                }
                case "local" -> out.println("Documenti locali: " + agent.localDocuments());
                case "quit" -> {
                    return false;
                }
                default -> out.println("Comando sconosciuto. " + USAGE);
            }
        } catch (NumberFormatException ex) {
            out.println("ERRORE: id non numerico: " + parts[1]);
        } catch (ProtocolException ex) {
            out.println("ERRORE " + ex.getReason() + ": " + ex.getMessage());
        } catch (IOException ex) {
            out.println("ERRORE di rete: " + ex.getMessage());
        }
        return true;
    }

    private static int parseId(String value) {
        return Integer.parseInt(value);
    }
}
