package at.sv.huebridge.api.hue;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;

@Slf4j
public final class HueHttpsClientFactory {

    private HueHttpsClientFactory() {
    }

    /**
     * @param certificate the PEM encoded root certificate of the bridge. If null, the JVM trust store is used.
     * @param insecure    disables certificate validation altogether
     */
    public static OkHttpClient createHttpsClient(String bridgeHost, String applicationKey, Path certificate,
                                                 boolean insecure) throws Exception {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    Request request = chain.request();
                    Request modifiedRequest = request.newBuilder()
                                                     .header("hue-application-key", applicationKey)
                                                     .build();
                    return chain.proceed(modifiedRequest);
                });
        if (insecure) {
            log.warn("Disabling SSL certificate validation.");
            X509TrustManager trustManager = createTrustAllTrustManager();
            builder.sslSocketFactory(createSSLContext(trustManager).getSocketFactory(), trustManager)
                   .hostnameVerifier((hostname, session) -> true);
        } else if (certificate != null) {
            X509TrustManager trustManager = createTrustManager(certificate);
            builder.sslSocketFactory(createSSLContext(trustManager).getSocketFactory(), trustManager)
                   .hostnameVerifier((hostname, session) -> hostname.equals(bridgeHost));
        }
        return builder.build();
    }

    private static X509TrustManager createTrustManager(Path certificateFile) throws Exception {
        Certificate certificate = loadCertificate(certificateFile);
        KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
        keyStore.load(null, new char[0]);
        keyStore.setCertificateEntry("HueCertificate", certificate);
        TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagerFactory.init(keyStore);
        return (X509TrustManager) trustManagerFactory.getTrustManagers()[0];
    }

    private static Certificate loadCertificate(Path certificateFile) throws Exception {
        try (InputStream certInputStream = Files.newInputStream(certificateFile)) {
            return CertificateFactory.getInstance("X.509").generateCertificate(certInputStream);
        }
    }

    private static X509TrustManager createTrustAllTrustManager() {
        return new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[]{};
            }
        };
    }

    private static SSLContext createSSLContext(X509TrustManager trustManager) throws Exception {
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{trustManager}, null);
        return context;
    }
}
