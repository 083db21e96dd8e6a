package Common;

/** GET &lt;id&gt; &lt;token&gt;, inviata direttamente al Transfer Listener di un peer. */
public class GetRequest extends Request {
    private final int id;

    public GetRequest(int id, String token) {
        super(token);
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public String getCommand() {
        return Protocol.GET;
    }

    @Override
    public String toWire() {
        return Protocol.GET + " " + id + " " + getToken();
    }
}
