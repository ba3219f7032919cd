package edu.mcw.rgd.dataload.patientvariants;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * @since 10/7/26
 * common code for the json web services used to annotate variants:
 * throttled GET requests with a fixed timeout, parsed into a json tree
 */
public abstract class RestClient {

    Logger logDebug = LogManager.getLogger("dbg");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Throttle throttle = new Throttle();
    private HttpClient httpClient;
    private int timeoutSeconds = 30;

    /**
     * name of the service, used in error messages
     */
    abstract String getServiceName();

    /**
     * issue one GET request; waits for the throttle first
     * @param uri request uri
     * @return parsed json body
     * @throws ServiceConnectionException on i/o failure, timeout, non-2xx status or unparseable body
     */
    JsonNode getJson(URI uri) throws ServiceConnectionException {

        try {
            throttle.acquire();
        } catch( InterruptedException e ) {
            Thread.currentThread().interrupt();
            throw new ServiceConnectionException(getServiceName()+" request interrupted: "+uri, e);
        }
        logDebug.debug(getServiceName()+" GET "+uri);

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(getTimeoutSeconds()))
            .header("Accept", "application/json")
            .GET()
            .build();

        // the timeout covers the whole exchange, body included
        CompletableFuture<HttpResponse<String>> future = getHttpClient().sendAsync(request, HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> response;
        try {
            response = future.get(getTimeoutSeconds(), TimeUnit.SECONDS);
        } catch( TimeoutException e ) {
            future.cancel(true);
            throw new ServiceConnectionException(getServiceName()+" did not reply within "+getTimeoutSeconds()+" s: "+uri, e);
        } catch( ExecutionException e ) {
            throw new ServiceConnectionException("Unable to connect to "+getServiceName()+": "+e.getCause(), e.getCause());
        } catch( InterruptedException e ) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ServiceConnectionException(getServiceName()+" request interrupted: "+uri, e);
        }

        if( response.statusCode()/100 != 2 ) {
            throw new ServiceConnectionException(getServiceName()+" returned HTTP status "+response.statusCode()+" for "+uri);
        }

        JsonNode reply;
        try {
            reply = StringUtils.isBlank(response.body()) ? null : mapper.readTree(response.body());
        } catch( JsonProcessingException e ) {
            throw new ServiceConnectionException(getServiceName()+" returned an unparseable response for "+uri, e);
        }
        if( reply==null || reply.isMissingNode() ) {
            throw new ServiceConnectionException(getServiceName()+" returned an empty response for "+uri);
        }
        return reply;
    }

    synchronized HttpClient getHttpClient() {
        if( httpClient==null ) {
            httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(getTimeoutSeconds()))
                .build();
        }
        return httpClient;
    }

    public Throttle getThrottle() {
        return throttle;
    }

    public void setDelayMs(long delayMs) {
        throttle.setDelayMs(delayMs);
    }

    public long getDelayMs() {
        return throttle.getDelayMs();
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
