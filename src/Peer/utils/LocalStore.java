package Peer.utils;

import Common.Logger;
import Common.Protocol;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

/**
 * Archivio locale dei documenti di un peer: il documento con id N è il file rfcN.txt
 * nella cartella del peer.
 *
 * Scrittore e lettori non si coordinano con lock: un documento ricevuto viene scritto
 * in un file di appoggio e pubblicato con una rename atomica solo a trasferimento completo,
 * quindi chi legge vede sempre la versione precedente intera oppure quella nuova intera.
 */
public class LocalStore {
    private static final Pattern DOCUMENT_FILE = Pattern.compile("rfc([1-9]\\d*)\\.txt");

    private final Path directory;

    public LocalStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path pathOf(int id) {
        return directory.resolve(Protocol.fileNameFor(id));
    }

    // Ritorna true se il documento esiste ed è un file regolare
    public boolean has(int id) {
        return Files.isRegularFile(pathOf(id));
    }

    /**
     * Legge il contenuto completo del documento.
     * @throws java.nio.file.NoSuchFileException se il documento non è presente
     */
    public byte[] read(int id) throws IOException {
        return Files.readAllBytes(pathOf(id));
    }

    // Ritorna gli id dei documenti presenti nella cartella, in ordine crescente
    public List<Integer> listIds() throws IOException {
        List<Integer> ids = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return ids;
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                Matcher m = DOCUMENT_FILE.matcher(file.getFileName().toString());
                if (m.matches()) {
                    try {
                        int id = Integer.parseInt(m.group(1));
                        if (id > 0) {
                            ids.add(id);
                        }
                    } catch (NumberFormatException ex) {
                        Logger.warn("Nome file ignorato, id fuori intervallo: " + file.getFileName());
                    }
                }
            });
        }
        Collections.sort(ids);
        return ids;
    }

    /**
     * Titolo del documento, ricavato dalla sua prima riga.
     * @throws java.nio.file.NoSuchFileException se il documento non è presente
     */
    public String readTitle(int id) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(pathOf(id)), StandardCharsets.UTF_8))) {
            return extractTitle(reader.readLine(), id);
        }
    }

    /**
     * Convenzione del titolo:
     * "RFC 123 - Titolo" -> "Titolo" (testo dopo il primo '-'),
     * "RFC 123 Titolo" -> "Titolo",
     * altrimenti l'intera prima riga; se vuota "RFC <id>".
     */
    public static String extractTitle(String firstLine, int id) {
        String fallback = "RFC " + id;
        if (firstLine == null || firstLine.isBlank()) {
            return fallback;
        }
        String line = firstLine.strip();
        int dash = line.indexOf('-');
        if (dash >= 0) {
            String title = line.substring(dash + 1).strip();
            return title.isEmpty() ? fallback : title;
        }
        String[] parts = line.split("\\s+");
        if (parts.length >= 3 && parts[0].equalsIgnoreCase("RFC")) {
            return String.join(" ", List.of(parts).subList(2, parts.length));
        }
        return line;
    }

    /** Scrive un documento creato localmente. */
    public void write(int id, byte[] content) throws IOException {
        publish(id, new ByteArrayInputStream(content), content.length);
    }

    /**
     * Copia lo stream in un file di appoggio e lo pubblica come rfcN.txt solo se sono arrivati
     * esattamente expectedLength byte. In caso di errore il file di appoggio viene eliminato
     * e l'eventuale versione precedente resta intatta.
     *
     * @return numero di byte pubblicati
     */
    public long publish(int id, InputStream data, long expectedLength) throws IOException {
        Files.createDirectories(directory);
        // nome univoco creato con CREATE_NEW: i permessi seguono la umask come per i file scritti a mano
        Path staging = directory.resolve(".rfc" + id + "-" + UUID.randomUUID() + ".part");
        boolean published = false;
        try {
            long copied;
            try (OutputStream out = Files.newOutputStream(staging, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                copied = IOUtils.copyLarge(data, out);
            }
            if (copied != expectedLength) {
                throw new IOException("Trasferimento incompleto per il documento " + id
                        + ": ricevuti " + copied + " byte su " + expectedLength);
            }
            moveIntoPlace(staging, pathOf(id));
            published = true;
            return copied;
        } finally {
            if (!published) {
                FileUtils.deleteQuietly(staging.toFile());
            }
        }
    }

    private void moveIntoPlace(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Logger.warn("Rename atomica non supportata in " + directory + ", uso una sostituzione semplice");
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** Rimuove il documento locale, se presente. */
    public boolean delete(int id) throws IOException {
        return Files.deleteIfExists(pathOf(id));
    }
}
