package Index;

import Common.PeerAddress;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Voce dell'indice: id, titolo fissato dalla prima ADD e insieme dei peer che possiedono il documento.
 * L'insieme dei possessori è protetto da un lock dedicato al singolo documento,
 * così registrazioni su id diversi non si bloccano a vicenda.
 * Non esce mai dal package: l'esterno vede solo copie.
 */
class DocumentRecord {
    private final int id;
    private final String title;
    // ordine di inserimento: il primo possessore registrato resta il primo restituito
    private final Set<PeerAddress> holders = new LinkedHashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    DocumentRecord(int id, String title, PeerAddress firstHolder) {
        this.id = id;
        this.title = title;
        this.holders.add(firstHolder);
    }

    int getId() {
        return id;
    }

    String getTitle() {
        return title;
    }

    // true se l'indirizzo non era già presente
    boolean addHolder(PeerAddress address) {
        lock.writeLock().lock();
        try {
            return holders.add(address);
        } finally {
            lock.writeLock().unlock();
        }
    }

    List<PeerAddress> holders() {
        lock.readLock().lock();
        try {
            return List.copyOf(holders);
        } finally {
            lock.readLock().unlock();
        }
    }
}
