package Common;

/**
 * ADD &lt;id&gt; &lt;host&gt; &lt;port&gt; &lt;token&gt; &lt;titolo...&gt;
 * Il titolo occupa il resto della riga e può contenere spazi.
 */
public class AddRequest extends Request {
    private final int id;
    private final String title;
    private final PeerAddress address;

    public AddRequest(int id, String title, PeerAddress address, String token) {
        super(token);
        this.id = id;
        this.title = title;
        this.address = address;
    }

    public int getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public PeerAddress getAddress() {
        return address;
    }

    @Override
    public String getCommand() {
        return Protocol.ADD;
    }

    @Override
    public String toWire() {
        return Protocol.ADD + " " + id + " " + address.toWire() + " " + getToken() + " " + title;
    }
}
