package Index;

import static org.junit.jupiter.api.Assertions.*;

import Common.Protocol;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IndexServerTest {

    private static final String TOK = Protocol.VERSION;

    private IndexServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = new IndexServer(0, Set.of(TOK));
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.shutdown();
    }

    /** Connessione grezza verso il server, una riga alla volta. */
    private final class Connection implements AutoCloseable {
        private final Socket socket;
        private final OutputStream out;
        private final BufferedReader in;

        Connection() throws IOException {
            socket = new Socket("127.0.0.1", server.getPort());
            socket.setSoTimeout(5000);
            out = socket.getOutputStream();
            in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        }

        // invia una riga e legge la risposta completa (riga di stato + righe annunciate dal conteggio)
        List<String> request(String line) throws IOException {
            out.write((line + "\r\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
            List<String> reply = new ArrayList<>();
            String status = in.readLine();
            assertNotNull(status, "nessuna risposta a " + line);
            reply.add(status);
            String[] parts = status.split(" ");
            if (parts[0].equals("OK") && parts.length == 2) {
                int count = Integer.parseInt(parts[1]);
                for (int i = 0; i < count; i++) {
                    reply.add(in.readLine());
                }
            }
            return reply;
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }

    @Test
    void addThenLookupAndList() throws IOException {
        try (Connection c = new Connection()) {
            assertEquals(List.of("OK"), c.request("ADD 100 hostA 5001 " + TOK + " Test RFC"));
            assertEquals(List.of("OK"), c.request("ADD 100 hostB 5002 " + TOK + " Another Title"));
            assertEquals(List.of("OK"), c.request("ADD 100 hostA 5001 " + TOK + " Test RFC"));

            assertEquals(List.of("OK 2", "hostA 5001", "hostB 5002"), c.request("LOOKUP 100 " + TOK));
            assertEquals(List.of("OK 1", "100 Test RFC"), c.request("LIST " + TOK));
        }
    }

    @Test
    void lookupOfUnknownIdIsNotFound() throws IOException {
        try (Connection c = new Connection()) {
            assertEquals(List.of("ERROR NOT_FOUND"), c.request("LOOKUP 999 " + TOK));
        }
    }

    @Test
    void emptyDirectoryListsZeroEntries() throws IOException {
        try (Connection c = new Connection()) {
            assertEquals(List.of("OK 0"), c.request("LIST " + TOK));
        }
    }

    @Test
    void listIsSortedAscending() throws IOException {
        try (Connection c = new Connection()) {
            c.request("ADD 3457 h 1 " + TOK + " Requirements for IPsec Remote Access Scenarios");
            c.request("ADD 123 h 1 " + TOK + " A Proferred Official ICP");
            c.request("ADD 2345 h 1 " + TOK + " Domain Names and Company Name Retrieval");

            assertEquals(List.of("OK 3",
                    "123 A Proferred Official ICP",
                    "2345 Domain Names and Company Name Retrieval",
                    "3457 Requirements for IPsec Remote Access Scenarios"), c.request("LIST " + TOK));
        }
    }

    @Test
    void rejectsWrongTokenOnEveryCommand() throws IOException {
        try (Connection c = new Connection()) {
            assertEquals(List.of("ERROR UNSUPPORTED_PROTOCOL"), c.request("ADD 1 h 1 P2P-CI/2.0 t"));
            assertEquals(List.of("ERROR UNSUPPORTED_PROTOCOL"), c.request("LOOKUP 1 P2P-CI/2.0"));
            assertEquals(List.of("ERROR UNSUPPORTED_PROTOCOL"), c.request("LIST P2P-CI/2.0"));
        }
        assertEquals(0, server.getStore().size());
    }

    @Test
    void rejectsInvalidId() throws IOException {
        try (Connection c = new Connection()) {
            assertEquals(List.of("ERROR INVALID_ID"), c.request("ADD 0 h 1 " + TOK + " t"));
            assertEquals(List.of("ERROR INVALID_ID"), c.request("ADD -3 h 1 " + TOK + " t"));
        }
    }

    @Test
    void malformedLinesGetErrorAndConnectionStaysUsable() throws IOException {
        try (Connection c = new Connection()) {
            assertEquals(List.of("ERROR UNKNOWN_COMMAND"), c.request("HELLO"));
            assertEquals(List.of("ERROR BAD_REQUEST"), c.request("LOOKUP x " + TOK));
            assertEquals(List.of("ERROR BAD_REQUEST"), c.request("ADD 1 h " + TOK));
            // GET è un comando peer-to-peer
            assertEquals(List.of("ERROR UNKNOWN_COMMAND"), c.request("GET 1 " + TOK));
            // una riga vuota riceve comunque una risposta
            assertEquals(List.of("ERROR BAD_REQUEST"), c.request("   "));
            assertEquals(List.of("ERROR BAD_REQUEST"), c.request(""));

            assertEquals(List.of("OK"), c.request("ADD 1 h 1 " + TOK + " Fine"));
            assertEquals(List.of("OK 1", "h 1"), c.request("LOOKUP 1 " + TOK));
        }
    }

    @Test
    void brokenConnectionDoesNotAffectOthers() throws IOException {
        try (Connection healthy = new Connection()) {
            Connection broken = new Connection();
            broken.out.write("ADD 5 h 1 ".getBytes(StandardCharsets.UTF_8));
            broken.close();

            assertEquals(List.of("OK"), healthy.request("ADD 6 h 1 " + TOK + " Six"));
            assertEquals(List.of("OK 1", "6 Six"), healthy.request("LIST " + TOK));
        }
    }

    @Test
    void concurrentPeersRegisteringDistinctIdsAreAllListed() throws Exception {
        int peers = 20;
        List<Thread> threads = new ArrayList<>();
        List<Throwable> failures = java.util.Collections.synchronizedList(new ArrayList<>());
        for (int i = 1; i <= peers; i++) {
            int id = i;
            Thread t = new Thread(() -> {
                try (Connection c = new Connection()) {
                    assertEquals(List.of("OK"), c.request("ADD " + id + " peer" + id + " " + (6000 + id) + " " + TOK + " Doc " + id));
                    assertEquals(List.of("OK"), c.request("ADD 500 peer" + id + " " + (6000 + id) + " " + TOK + " Shared"));
                } catch (Throwable ex) {
                    failures.add(ex);
                }
            });
            threads.add(t);
            t.start();
        }
        for (Thread t : threads) {
            t.join(10_000);
        }
        assertTrue(failures.isEmpty(), () -> "fallimenti: " + failures);

        try (Connection c = new Connection()) {
            List<String> list = c.request("LIST " + TOK);
            assertEquals("OK " + (peers + 1), list.get(0));
            List<String> holders = c.request("LOOKUP 500 " + TOK);
            assertEquals("OK " + peers, holders.get(0));
            assertEquals(peers, new java.util.HashSet<>(holders.subList(1, holders.size())).size());
        }
    }

    @Test
    void shutdownStopsAcceptingConnections() throws Exception {
        int port = server.getPort();
        server.shutdown();
        server.awaitTermination();

        assertFalse(server.isRunning());
        assertThrows(IOException.class, () -> new Socket("127.0.0.1", port).close());
    }

    @Test
    void connectionArrivingDuringShutdownIsClosed() throws Exception {
        try (ServerSocket local = new ServerSocket(0);
             Socket remote = new Socket("127.0.0.1", local.getLocalPort());
             Socket accepted = local.accept()) {
            server.shutdown();

            server.dispatch(accepted);

            assertTrue(accepted.isClosed());
            remote.setSoTimeout(5000);
            assertEquals(-1, remote.getInputStream().read());
        }
    }
}
