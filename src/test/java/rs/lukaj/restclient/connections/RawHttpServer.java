package rs.lukaj.restclient.connections;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Tiny server answering every request with the same canned bytes and closing the connection. Used where the wire
 * format itself is tested, which a real server would normalize.
 */
public class RawHttpServer implements AutoCloseable {
    private final ServerSocket server;
    private final byte[] response;
    private final List<String> requestLines = new CopyOnWriteArrayList<>();
    private final List<List<String>> requestHeaders = new CopyOnWriteArrayList<>();
    private final Thread acceptor;

    public RawHttpServer(String response) throws IOException {
        this.server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        this.response = response.getBytes(ISO_8859_1);
        this.acceptor = new Thread(this::serve, "raw-http-server");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    public int getPort() {
        return server.getLocalPort();
    }

    public String url() {
        return "http://127.0.0.1:" + getPort();
    }

    public List<String> getRequestLines() {
        return requestLines;
    }

    public List<List<String>> getRequestHeaders() {
        return requestHeaders;
    }

    private void serve() {
        while(!server.isClosed()) {
            try (Socket socket = server.accept()) {
                InputStream in = socket.getInputStream();
                String line = readLine(in);
                List<String> headers = new CopyOnWriteArrayList<>();
                String header;
                while(!(header = readLine(in)).isEmpty()) headers.add(header);
                requestLines.add(line);
                requestHeaders.add(headers);
                OutputStream out = socket.getOutputStream();
                out.write(response);
                out.flush();
            } catch (IOException e) {
                //server closed, or client went away; either way nothing to answer
            }
        }
    }

    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int c;
        while((c = in.read()) != '\n') {
            if(c == -1) throw new IOException("Client closed connection");
            if(c != '\r') line.write(c);
        }
        return new String(line.toByteArray(), ISO_8859_1);
    }

    @Override
    public void close() throws IOException {
        server.close();
    }
}
