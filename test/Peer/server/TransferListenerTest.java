package Peer.server;

import static org.junit.jupiter.api.Assertions.*;

import Common.Protocol;
import Peer.utils.LocalStore;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Set;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TransferListenerTest {

    @TempDir
    Path dir;

    private LocalStore store;
    private TransferListener listener;

    @BeforeEach
    void start() throws IOException {
        store = new LocalStore(dir);
        listener = new TransferListener(0, store, Set.of(Protocol.VERSION));
        listener.start();
    }

    @AfterEach
    void stop() {
        listener.stop();
    }

    // invia una riga e restituisce tutto quello che arriva fino alla chiusura
    private byte[] exchange(String line) throws IOException {
        try (Socket socket = new Socket("127.0.0.1", listener.getPort())) {
            socket.setSoTimeout(5000);
            socket.getOutputStream().write((line + "\r\n").getBytes(StandardCharsets.UTF_8));
            socket.getOutputStream().flush();
            try (InputStream in = socket.getInputStream()) {
                return IOUtils.toByteArray(in);
            }
        }
    }

    @Test
    void servesExactBytesAfterStatusLine() throws IOException {
        byte[] content = "RFC 100 - Test RFC\r\nERROR inside the body\n".getBytes(StandardCharsets.UTF_8);
        store.write(100, content);

        byte[] reply = exchange("GET 100 " + Protocol.VERSION);

        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        expected.write(("OK " + content.length + "\r\n").getBytes(StandardCharsets.UTF_8));
        expected.write(content);
        assertArrayEquals(expected.toByteArray(), reply);
    }

    @Test
    void emptyDocumentIsServedWithZeroLength() throws IOException {
        store.write(8, new byte[0]);

        assertEquals("OK 0\r\n", new String(exchange("GET 8 " + Protocol.VERSION), StandardCharsets.UTF_8));
    }

    @Test
    void missingDocumentIsNotFound() throws IOException {
        assertEquals("ERROR NOT_FOUND\r\n", new String(exchange("GET 5 " + Protocol.VERSION), StandardCharsets.UTF_8));
    }

    @Test
    void deletedDocumentIsNotFound() throws IOException {
        store.write(5, "RFC 5 - Gone\n".getBytes(StandardCharsets.UTF_8));
        store.delete(5);

        assertEquals("ERROR NOT_FOUND\r\n", new String(exchange("GET 5 " + Protocol.VERSION), StandardCharsets.UTF_8));
    }

    @Test
    void wrongTokenIsRejected() throws IOException {
        store.write(5, "x".getBytes(StandardCharsets.UTF_8));

        assertEquals("ERROR UNSUPPORTED_PROTOCOL\r\n", new String(exchange("GET 5 OTHER/1"), StandardCharsets.UTF_8));
    }

    @Test
    void controlPlaneCommandsAndGarbageAreRejected() throws IOException {
        assertEquals("ERROR UNKNOWN_COMMAND\r\n", new String(exchange("LIST " + Protocol.VERSION), StandardCharsets.UTF_8));
        assertEquals("ERROR BAD_REQUEST\r\n", new String(exchange("GET five " + Protocol.VERSION), StandardCharsets.UTF_8));
        assertEquals("ERROR UNKNOWN_COMMAND\r\n", new String(exchange("garbage"), StandardCharsets.UTF_8));
    }

    @Test
    void servesConcurrentRequests() throws Exception {
        byte[] content = new byte[256 * 1024];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) i;
        }
        store.write(1, content);
        String header = "OK " + content.length + "\r\n";

        Thread[] clients = new Thread[8];
        boolean[] ok = new boolean[clients.length];
        for (int i = 0; i < clients.length; i++) {
            int index = i;
            clients[i] = new Thread(() -> {
                try {
                    byte[] reply = exchange("GET 1 " + Protocol.VERSION);
                    ok[index] = reply.length == header.length() + content.length;
                } catch (IOException e) {
                    ok[index] = false;
                }
            });
            clients[i].start();
        }
        for (Thread t : clients) {
            t.join(10_000);
        }
        for (boolean b : ok) {
            assertTrue(b);
        }
    }

    @Test
    void connectionArrivingAfterStopIsClosed() throws Exception {
        try (ServerSocket local = new ServerSocket(0);
             Socket remote = new Socket("127.0.0.1", local.getLocalPort());
             Socket accepted = local.accept()) {
            listener.stop();

            listener.dispatch(accepted);

            assertTrue(accepted.isClosed());
            remote.setSoTimeout(5000);
            assertEquals(-1, remote.getInputStream().read());
        }
    }
}
