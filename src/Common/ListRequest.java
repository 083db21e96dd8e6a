package Common;

/** LIST &lt;token&gt; */
public class ListRequest extends Request {

    public ListRequest(String token) {
        super(token);
    }

    @Override
    public String getCommand() {
        return Protocol.LIST;
    }

    @Override
    public String toWire() {
        return Protocol.LIST + " " + getToken();
    }
}
