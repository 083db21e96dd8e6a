package Common;

/** LOOKUP &lt;id&gt; &lt;token&gt; */
public class LookupRequest extends Request {
    private final int id;

    public LookupRequest(int id, String token) {
        super(token);
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public String getCommand() {
        return Protocol.LOOKUP;
    }

    @Override
    public String toWire() {
        return Protocol.LOOKUP + " " + id + " " + getToken();
    }
}
