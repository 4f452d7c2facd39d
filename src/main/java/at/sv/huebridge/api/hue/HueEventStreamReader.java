package at.sv.huebridge.api.hue;

import com.launchdarkly.eventsource.ConnectStrategy;
import com.launchdarkly.eventsource.ErrorStrategy;
import com.launchdarkly.eventsource.EventSource;
import com.launchdarkly.eventsource.background.BackgroundEventHandler;
import com.launchdarkly.eventsource.background.BackgroundEventSource;
import okhttp3.OkHttpClient;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

public final class HueEventStreamReader {

    private final String applicationKey;
    private final URI eventUrl;
    private final BackgroundEventHandler eventHandler;
    private final OkHttpClient httpsClient;

    public HueEventStreamReader(String host, String applicationKey, OkHttpClient httpsClient,
                                BackgroundEventHandler eventHandler, int eventStreamReadTimeoutInMinutes) {
        this.applicationKey = applicationKey;
        this.httpsClient = httpsClient.newBuilder()
                                      .connectTimeout(Duration.ofSeconds(15))
                                      .readTimeout(Duration.ofMinutes(eventStreamReadTimeoutInMinutes))
                                      .build();
        this.eventHandler = eventHandler;
        eventUrl = createUrl("https://" + host + "/eventstream/clip/v2");
    }

    private static URI createUrl(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Failed to construct event stream url", e);
        }
    }

    /**
     * Starts reading in the background. The connection is restored automatically after errors or timeouts.
     *
     * @return the started source, to be closed to stop reading
     */
    public BackgroundEventSource start() {
        BackgroundEventSource eventSource = createBackgroundEventSource();
        eventSource.start();
        return eventSource;
    }

    private BackgroundEventSource createBackgroundEventSource() {
        return new BackgroundEventSource.Builder(eventHandler,
                new EventSource.Builder(ConnectStrategy.http(eventUrl)
                                                       .httpClient(httpsClient)
                                                       .header("hue-application-key", applicationKey))
                        .errorStrategy(ErrorStrategy.alwaysContinue())
        ).build();
    }
}
