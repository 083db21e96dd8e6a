package Common;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RequestParserTest {

    @Test
    void parsesAddWithMultiWordTitle() throws ProtocolException {
        Request request = RequestParser.parse("ADD 100 peer-a 5001 P2P-CI/1.0 Test RFC  with spaces");

        AddRequest add = assertInstanceOf(AddRequest.class, request);
        assertEquals(100, add.getId());
        assertEquals(new PeerAddress("peer-a", 5001), add.getAddress());
        assertEquals("P2P-CI/1.0", add.getToken());
        assertEquals("Test RFC  with spaces", add.getTitle());
    }

    @Test
    void parsesLookupListAndGet() throws ProtocolException {
        LookupRequest lookup = assertInstanceOf(LookupRequest.class, RequestParser.parse("LOOKUP 7 TOK"));
        assertEquals(7, lookup.getId());
        assertEquals("TOK", lookup.getToken());

        ListRequest list = assertInstanceOf(ListRequest.class, RequestParser.parse("LIST TOK\r"));
        assertEquals("TOK", list.getToken());

        GetRequest get = assertInstanceOf(GetRequest.class, RequestParser.parse("  GET 12 TOK  "));
        assertEquals(12, get.getId());
    }

    @Test
    void encodedRequestsParseBack() throws ProtocolException {
        AddRequest add = new AddRequest(3, "Some Title", new PeerAddress("10.0.0.1", 9000), "TOK");
        AddRequest parsed = (AddRequest) RequestParser.parse(add.toWire());

        assertEquals(add.getId(), parsed.getId());
        assertEquals(add.getTitle(), parsed.getTitle());
        assertEquals(add.getAddress(), parsed.getAddress());
    }

    @Test
    void rejectsUnknownCommand() {
        ProtocolException ex = assertThrows(ProtocolException.class, () -> RequestParser.parse("DELETE 1 TOK"));
        assertEquals(Protocol.UNKNOWN_COMMAND, ex.getReason());
    }

    @Test
    void commandsAreCaseSensitive() {
        ProtocolException ex = assertThrows(ProtocolException.class, () -> RequestParser.parse("lookup 1 TOK"));
        assertEquals(Protocol.UNKNOWN_COMMAND, ex.getReason());
    }

    @Test
    void rejectsMalformedLines() {
        String[] malformed = {
                "",
                "   ",
                "LOOKUP 1",
                "LOOKUP 1 TOK extra",
                "LOOKUP abc TOK",
                "LIST",
                "LIST TOK extra",
                "GET TOK",
                "ADD 1 host 5000 TOK",
                "ADD x host 5000 TOK title",
                "ADD 1 host port TOK title",
                "ADD 1 host 0 TOK title",
                "ADD 1 host 70000 TOK title",
        };
        for (String line : malformed) {
            ProtocolException ex = assertThrows(ProtocolException.class, () -> RequestParser.parse(line), line);
            assertEquals(Protocol.BAD_REQUEST, ex.getReason(), line);
        }
    }

    @Test
    void nullLineIsBadRequest() {
        ProtocolException ex = assertThrows(ProtocolException.class, () -> RequestParser.parse(null));
        assertEquals(Protocol.BAD_REQUEST, ex.getReason());
    }

    @Test
    void tokenIsExtractedButNotValidated() throws ProtocolException {
        assertEquals("WHATEVER/9", RequestParser.parse("LIST WHATEVER/9").getToken());
    }
}
