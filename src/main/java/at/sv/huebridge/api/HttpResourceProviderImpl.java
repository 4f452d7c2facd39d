package at.sv.huebridge.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.URL;

@Slf4j
public final class HttpResourceProviderImpl implements HttpResourceProvider {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_LOGGED_BODY_LENGTH = 150;

    private final OkHttpClient httpClient;

    public HttpResourceProviderImpl(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String getResource(URL url) {
        log.trace("Get: {}", url);
        return performCall(new Request.Builder().url(url).build());
    }

    @Override
    public String putResource(URL url, String body) {
        log.trace("Put: {}: {}", url, truncate(body));
        return performCall(new Request.Builder()
                .url(url)
                .put(RequestBody.create(body, JSON))
                .build());
    }

    static String truncate(String body) {
        return body.length() > MAX_LOGGED_BODY_LENGTH ? body.substring(0, MAX_LOGGED_BODY_LENGTH) + "..." : body;
    }

    private String performCall(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = readBody(response);
            assertSuccessful(response, body);
            return body;
        } catch (IOException e) {
            log.error("Failed '{} {}'", request.method(), request.url());
            throw new BridgeConnectionFailure("Failed '" + request.method() + " " + request.url() + "'", e);
        }
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return "";
        }
        return body.string();
    }

    private static void assertSuccessful(Response response, String body) throws IOException {
        int code = response.code();
        if (code == 401 || code == 403) {
            throw new BridgeAuthenticationFailure();
        }
        if (code == 404) {
            throw new ResourceNotFoundException("Resource not found: " + body);
        }
        if (code == 429) {
            throw new ApiFailure("Rate limit exceeded: " + body);
        }
        if (code >= 500) {
            throw new ApiFailure("Server error: " + body);
        }
        if (!response.isSuccessful()) {
            throw new IOException("Unexpected return code " + code + ". " + body);
        }
    }
}
