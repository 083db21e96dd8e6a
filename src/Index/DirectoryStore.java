package Index;

import Common.DocumentSummary;
import Common.PeerAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * gestisce lo stato interno dell'Index Server:
 * mappa id documento -> DocumentRecord (titolo + possessori)
 * meccanismi di sincronizzazione
 *
 * L'unico accesso allo stato passa da register / find / snapshot.
 * - register e find prendono il lock di tabella in lettura (condiviso) e poi il lock del singolo documento:
 *   operazioni su id diversi procedono in parallelo, quelle sullo stesso id sono serializzate.
 * - snapshot prende il lock di tabella in scrittura: nessuna register è in corso durante la copia,
 *   quindi la vista restituita è coerente in un singolo istante.
 */
public class DirectoryStore {
    // Mappa id -> record; i record non vengono mai rimossi
    private final Map<Integer, DocumentRecord> records = new ConcurrentHashMap<>();
    // lock di tabella: condiviso per le operazioni sul singolo id, esclusivo per lo snapshot
    private final ReadWriteLock tableLock = new ReentrantReadWriteLock();

    /**
     * Registra un possessore per il documento.
     * Se l'id è nuovo crea il record con il titolo dato, altrimenti aggiunge l'indirizzo
     * ai possessori (nessun effetto se già presente) e ignora il titolo ricevuto.
     *
     * @return true se l'indirizzo è stato aggiunto, false se era già registrato
     * @throws IllegalArgumentException se l'id non è positivo, il titolo è vuoto o l'indirizzo manca
     */
    public boolean register(int id, String title, PeerAddress address) {
        if (id <= 0) {
            throw new IllegalArgumentException("Id non valido: " + id);
        }
        if (address == null) {
            throw new IllegalArgumentException("Indirizzo mancante per il documento " + id);
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Titolo mancante per il documento " + id);
        }
        tableLock.readLock().lock();
        try {
            // computeIfAbsent è atomico: con due ADD concorrenti sullo stesso id vince il primo titolo.
            // Il record nasce già con il primo possessore, find non vede mai un insieme vuoto.
            boolean[] created = {false};
            DocumentRecord record = records.computeIfAbsent(id, k -> {
                created[0] = true;
                return new DocumentRecord(k, title.trim(), address);
            });
            return created[0] || record.addHolder(address);
        } finally {
            tableLock.readLock().unlock();
        }
    }

    /**
     * ritorna i possessori del documento, nell'ordine di registrazione.
     * Lista vuota se l'id è sconosciuto: un record esistente ha sempre almeno un possessore.
     */
    public List<PeerAddress> find(int id) {
        tableLock.readLock().lock();
        try {
            DocumentRecord record = records.get(id);
            return (record == null) ? List.of() : record.holders();
        } finally {
            tableLock.readLock().unlock();
        }
    }

    /** ritorna il titolo registrato per l'id, oppure null se l'id è sconosciuto */
    public String titleOf(int id) {
        DocumentRecord record = records.get(id);
        return (record == null) ? null : record.getTitle();
    }

    // Restituisce una copia immutabile delle coppie (id, titolo) ordinate per id crescente
    public List<DocumentSummary> snapshot() {
        List<DocumentSummary> result = new ArrayList<>();
        tableLock.writeLock().lock();
        try {
            for (DocumentRecord record : records.values()) {
                result.add(new DocumentSummary(record.getId(), record.getTitle()));
            }
        } finally {
            tableLock.writeLock().unlock();
        }
        result.sort((a, b) -> Integer.compare(a.getId(), b.getId()));
        return List.copyOf(result);
    }

    /** ritorna numero di documenti presenti nell'indice */
    public int size() {
        return records.size();
    }
}
