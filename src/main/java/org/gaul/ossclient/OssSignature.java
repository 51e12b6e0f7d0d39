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

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.google.common.base.CharMatcher;
import com.google.common.collect.Multimap;
import com.google.common.io.BaseEncoding;
import com.google.common.net.PercentEscaper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OSS V1 signatures.  Reference:
 * https://www.alibabacloud.com/help/en/oss/developer-reference/include-signatures-in-the-authorization-header
 */
final class OssSignature {
    private static final Logger logger = LoggerFactory.getLogger(
            OssSignature.class);
    private static final String HMAC_ALGORITHM = "HmacSHA1";
    private static final PercentEscaper URL_PARAMETER_ESCAPER =
            new PercentEscaper("-_.~", false);
    // RFC 7230 tchar
    private static final CharMatcher HEADER_NAME_CHARS =
            CharMatcher.inRange('a', 'z')
                    .or(CharMatcher.inRange('A', 'Z'))
                    .or(CharMatcher.inRange('0', '9'))
                    .or(CharMatcher.anyOf("!#$%&'*+-.^_`|~"))
                    .precomputed();
    private static final CharMatcher HEADER_VALUE_CHARS =
            CharMatcher.inRange(' ', '~').or(CharMatcher.is('\t'))
                    .precomputed();

    private OssSignature() { }

    /** Base64 HMAC-SHA1 of the request's string-to-sign. */
    static String sign(String keySecret, CanonicalRequest request) {
        String stringToSign = request.stringToSign();
        logger.trace("stringToSign: {}", stringToSign);
        return sign(keySecret, stringToSign);
    }

    static String sign(String keySecret, String stringToSign) {
        Mac mac;
        try {
            mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(keySecret.getBytes(
                    StandardCharsets.UTF_8), HMAC_ALGORITHM));
        } catch (InvalidKeyException | NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
        return BaseEncoding.base64().encode(mac.doFinal(
                stringToSign.getBytes(StandardCharsets.UTF_8)));
    }

    /** Value of the Authorization header: OSS keyId:signature. */
    static String authorization(String keyId, String keySecret,
            CanonicalRequest request) throws OssException {
        String authorization = "OSS " + keyId + ":" + sign(keySecret, request);
        checkHeader("Authorization", authorization);
        return authorization;
    }

    /** Presigned URL query parameters, with an escaped signature. */
    static String presignedQuery(String keyId, String keySecret,
            CanonicalRequest request) {
        return OssHttpHeaders.PARAMETER_ACCESS_KEY_ID + "=" +
                URL_PARAMETER_ESCAPER.escape(keyId) +
                "&" + OssHttpHeaders.PARAMETER_EXPIRES + "=" +
                request.getDateOrExpires() +
                "&" + OssHttpHeaders.PARAMETER_SIGNATURE + "=" +
                URL_PARAMETER_ESCAPER.escape(sign(keySecret, request));
    }

    /** RFC 1123 date in GMT with a two-digit day, as the Date header wants. */
    static String formatDate(Date date) {
        SimpleDateFormat formatter = new SimpleDateFormat(
                "EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);
        formatter.setTimeZone(TimeZone.getTimeZone("GMT"));
        return formatter.format(date);
    }

    static void checkHeaders(Multimap<String, String> headers)
            throws OssException {
        for (Map.Entry<String, String> entry : headers.entries()) {
            checkHeader(entry.getKey(), entry.getValue());
        }
    }

    static void checkHeader(String name, String value) throws OssException {
        if (name.isEmpty() || !HEADER_NAME_CHARS.matchesAllOf(name)) {
            throw new OssException(OssErrorKind.ENCODING,
                    "invalid header name: " + name);
        }
        if (!HEADER_VALUE_CHARS.matchesAllOf(value)) {
            throw new OssException(OssErrorKind.ENCODING,
                    "invalid value for header: " + name);
        }
    }
}
