package rs.lukaj.restclient.client;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class FutureResponseTest {

    @Test
    public void setOnce() {
        FutureResponse future = new FutureResponse();
        assertNull(future.peek());
        assertFalse(future.isDone());

        Response response = Response.failed("GET /x", 0, new IOException("down"), ContentType.JSON);
        future.set(response);
        assertTrue(future.isDone());
        assertSame(response, future.peek());
        assertSame(response, future.peek());
        assertThrows(IllegalStateException.class, () -> future.set(response));
        assertThrows(IllegalArgumentException.class, () -> new FutureResponse().set(null));
    }
}
