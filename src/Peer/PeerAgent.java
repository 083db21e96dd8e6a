package Peer;

import Common.DocumentSummary;
import Common.Logger;
import Common.NotFoundException;
import Common.PeerAddress;
import Common.ProtocolException;
import Peer.client.IndexClient;
import Peer.client.TransferClient;
import Peer.utils.LocalStore;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;

/**
 * Metà "client" di un peer: parla con l'Index Server (ADD / LOOKUP / LIST)
 * e scarica documenti direttamente dal Transfer Listener degli altri peer (GET).
 *
 * Ogni operazione è un singolo tentativo: nessun retry e nessun passaggio automatico
 * a un altro possessore. Un fallimento arriva al chiamante come eccezione.
 */
public class PeerAgent {
    private final PeerAddress self;
    private final LocalStore store;
    private final IndexClient indexClient;
    private final TransferClient transferClient;

    /**
     * self indirizzo del proprio Transfer Listener, pubblicizzato in ogni ADD
     */
    public PeerAgent(PeerAddress self, LocalStore store, IndexClient indexClient, TransferClient transferClient) {
        this.self = self;
        this.store = store;
        this.indexClient = indexClient;
        this.transferClient = transferClient;
    }

    public PeerAddress getSelf() {
        return self;
    }

    public LocalStore getStore() {
        return store;
    }

    /**
     * Registra presso l'indice un documento presente nel LocalStore, con il titolo letto dalla prima riga.
     * @return il titolo inviato
     * @throws NotFoundException se il documento non esiste localmente
     */
    public String add(int id, String token) throws IOException, ProtocolException {
        String title;
        try {
            title = store.readTitle(id);
        } catch (NoSuchFileException ex) {
            throw new NotFoundException("Documento " + id + " non presente in " + store.getDirectory());
        }
        indexClient.add(id, title, self, token);
        return title;
    }

    public List<PeerAddress> lookup(int id, String token) throws IOException, ProtocolException {
        return indexClient.lookup(id, token);
    }

    public List<DocumentSummary> list(String token) throws IOException, ProtocolException {
        return indexClient.list(token);
    }

    /**
     * LOOKUP seguito da GET verso il primo possessore restituito dall'indice.
     * A trasferimento riuscito il peer si registra a sua volta come possessore;
     * se questa registrazione fallisce il documento resta comunque salvato.
     *
     * @return il possessore da cui è stato scaricato il documento
     */
    public PeerAddress get(int id, String token) throws IOException, ProtocolException {
        List<PeerAddress> holders = indexClient.lookup(id, token);
        if (holders.isEmpty()) {
            throw new NotFoundException("Nessun possessore per il documento " + id);
        }
        PeerAddress source = holders.get(0);
        transferClient.fetch(source, id, token, store);
        Logger.info("Documento " + id + " salvato in " + store.pathOf(id));

        try {
            add(id, token);
        } catch (IOException | ProtocolException ex) {
            Logger.warn("Documento " + id + " scaricato ma non registrato presso l'indice: " + ex.getMessage());
        }
        return source;
    }

    /**
     * Registra all'avvio tutti i documenti già presenti nel LocalStore.
     * @return numero di documenti registrati con successo
     */
    public int registerLocalDocuments(String token) throws IOException {
        int registered = 0;
        for (int id : store.listIds()) {
            try {
                add(id, token);
                registered++;
            } catch (ProtocolException ex) {
                Logger.warn("Registrazione del documento " + id + " rifiutata: " + ex.getMessage());
            }
        }
        return registered;
    }

    public List<Integer> localDocuments() throws IOException {
        return store.listIds();
    }
}
