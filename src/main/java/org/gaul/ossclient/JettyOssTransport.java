/*
 * Copyright 2014-2025 Andrew Gaul <andrew@gaul.org>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gaul.ossclient;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.net.HttpHeaders;

import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.BytesContentProvider;
import org.eclipse.jetty.client.util.FutureResponseListener;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link OssTransport} backed by the Jetty HTTP client. */
public final class JettyOssTransport implements OssTransport {
    private static final Logger logger = LoggerFactory.getLogger(
            JettyOssTransport.class);

    private final HttpClient httpClient;
    private final long requestTimeout;
    private final int maxResponseSize;

    private JettyOssTransport(Builder builder) throws IOException {
        httpClient = new HttpClient(new SslContextFactory.Client());
        httpClient.setConnectTimeout(builder.connectTimeout);
        httpClient.setFollowRedirects(false);
        httpClient.setName("OssClient-Jetty");
        try {
            httpClient.start();
        } catch (Exception e) {
            throw new IOException("Unable to start HTTP client", e);
        }
        requestTimeout = builder.requestTimeout;
        maxResponseSize = builder.maxResponseSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public OssResponse execute(OssRequest ossRequest) throws IOException {
        Request request;
        try {
            request = httpClient.newRequest(ossRequest.getUrl());
        } catch (IllegalArgumentException iae) {
            throw new IOException("Invalid URL: " + ossRequest.getUrl(), iae);
        }
        request.method(ossRequest.getMethod())
                .timeout(requestTimeout, TimeUnit.MILLISECONDS);
        for (Map.Entry<String, String> entry :
                ossRequest.getHeaders().entries()) {
            // Jetty derives Content-Length from the content provider
            if (entry.getKey().equalsIgnoreCase(HttpHeaders.CONTENT_LENGTH)) {
                continue;
            }
            request.header(entry.getKey(), entry.getValue());
        }
        byte[] body = ossRequest.getBody();
        if (body != null) {
            request.content(new BytesContentProvider(body));
        }

        logger.debug("{} {}", ossRequest.getMethod(), ossRequest.getUrl());
        FutureResponseListener listener = new FutureResponseListener(request,
                maxResponseSize);
        request.send(listener);
        ContentResponse response;
        try {
            response = listener.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            InterruptedIOException iioe = new InterruptedIOException(
                    "Interrupted during " + ossRequest);
            iioe.initCause(ie);
            throw iioe;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Failed " + ossRequest, cause);
        }

        ListMultimap<String, String> headers = ArrayListMultimap.create();
        for (HttpField field : response.getHeaders()) {
            headers.put(field.getName(), field.getValue());
        }
        logger.debug("{} {} -> {}", ossRequest.getMethod(),
                ossRequest.getUrl(), response.getStatus());
        return new OssResponse(response.getStatus(), response.getReason(),
                headers, response.getContent());
    }

    @Override
    public void close() throws IOException {
        try {
            httpClient.stop();
        } catch (Exception e) {
            throw new IOException("Unable to stop HTTP client", e);
        }
    }

    public static final class Builder {
        private long connectTimeout = 15 * 1000;
        private long requestTimeout = 60 * 1000;
        private int maxResponseSize = 64 * 1024 * 1024;

        Builder() {
        }

        /** Read the transport settings of an OssClient properties file. */
        public static Builder fromProperties(Properties properties) {
            Builder builder = new Builder();

            String connectTimeout = properties.getProperty(
                    OssClientConstants.PROPERTY_CONNECT_TIMEOUT);
            if (connectTimeout != null) {
                builder.connectTimeout(Long.parseLong(connectTimeout));
            }

            String requestTimeout = properties.getProperty(
                    OssClientConstants.PROPERTY_REQUEST_TIMEOUT);
            if (requestTimeout != null) {
                builder.requestTimeout(Long.parseLong(requestTimeout));
            }

            String maxResponseSize = properties.getProperty(
                    OssClientConstants.PROPERTY_MAX_RESPONSE_SIZE);
            if (maxResponseSize != null) {
                builder.maxResponseSize(Integer.parseInt(maxResponseSize));
            }

            return builder;
        }

        public Builder connectTimeout(long connectTimeout) {
            checkArgument(connectTimeout > 0,
                    "must be greater than zero, was: %s", connectTimeout);
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(long requestTimeout) {
            checkArgument(requestTimeout > 0,
                    "must be greater than zero, was: %s", requestTimeout);
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder maxResponseSize(int maxResponseSize) {
            checkArgument(maxResponseSize > 0,
                    "must be greater than zero, was: %s", maxResponseSize);
            this.maxResponseSize = maxResponseSize;
            return this;
        }

        public JettyOssTransport build() throws IOException {
            return new JettyOssTransport(this);
        }
    }
}
