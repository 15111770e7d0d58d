/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fasts3url.signing;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import io.fasts3url.spi.credentials.Credential;
import io.fasts3url.spi.timestamps.AwsTimestamp;
import software.amazon.awssdk.utils.BinaryUtils;

import javax.crypto.Mac;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.fasts3url.signing.PresignQueryParameters.ALGORITHM;
import static io.fasts3url.signing.PresignQueryParameters.SIGNED_HEADERS;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static software.amazon.awssdk.utils.http.SdkHttpUtils.urlEncodeIgnoreSlashes;

/**
 * Signing material shared by every key of one batch: the request time, the derived
 * signing key, the credential scope and the canonical query string. Only the canonical
 * URI, and so the signature, differ per key.
 */
final class PresignBatch
{
    static final String SERVICE = "s3";
    static final String UNSIGNED_PAYLOAD = "UNSIGNED-PAYLOAD";

    private final BucketLocation location;
    private final String amzDate;
    private final String credentialScope;
    private final String canonicalQueryString;
    private final String canonicalHeaders;
    private final byte[] signingKey;

    private PresignBatch(BucketLocation location, String amzDate, String credentialScope, String canonicalQueryString, byte[] signingKey)
    {
        this.location = requireNonNull(location, "location is null");
        this.amzDate = requireNonNull(amzDate, "amzDate is null");
        this.credentialScope = requireNonNull(credentialScope, "credentialScope is null");
        this.canonicalQueryString = requireNonNull(canonicalQueryString, "canonicalQueryString is null");
        this.signingKey = requireNonNull(signingKey, "signingKey is null");
        this.canonicalHeaders = "host:" + location.bucketHost() + "\n";
    }

    static PresignBatch create(BucketLocation location, Credential credential, String region, Instant requestTime, Duration expiresIn)
    {
        String dateStamp = AwsTimestamp.toDateStamp(requestTime);
        String amzDate = AwsTimestamp.toRequestFormat(requestTime);
        String credentialScope = SigningKeys.credentialScope(dateStamp, region, SERVICE);

        byte[] signingKey = SigningKeys.deriveSigningKey(credential.secretKey(), dateStamp, region, SERVICE);
        PresignQueryParameters queryParameters = new PresignQueryParameters(
                credential.accessKey() + "/" + credentialScope,
                amzDate,
                expiresIn.toSeconds(),
                credential.session());

        return new PresignBatch(location, amzDate, credentialScope, queryParameters.toCanonicalQueryString(), signingKey);
    }

    String amzDate()
    {
        return amzDate;
    }

    String credentialScope()
    {
        return credentialScope;
    }

    String canonicalQueryString()
    {
        return canonicalQueryString;
    }

    List<String> presignAll(List<String> objectKeys)
    {
        Mac mac = SigningKeys.newMac(signingKey);
        ImmutableList.Builder<String> urls = ImmutableList.builderWithExpectedSize(objectKeys.size());
        for (String objectKey : objectKeys) {
            urls.add(presign(mac, objectKey));
        }
        return urls.build();
    }

    String presign(Mac mac, String objectKey)
    {
        String canonicalUri = location.canonicalUri(urlEncodeIgnoreSlashes(objectKey));
        String signature = BinaryUtils.toHex(mac.doFinal(stringToSign(canonicalUri).getBytes(UTF_8)));
        return location.endpointUrl() + canonicalUri + "?" + PresignQueryParameters.withSignature(canonicalQueryString, signature);
    }

    String canonicalRequest(String canonicalUri)
    {
        return String.join("\n",
                "GET",
                canonicalUri,
                canonicalQueryString,
                canonicalHeaders,
                SIGNED_HEADERS,
                UNSIGNED_PAYLOAD);
    }

    String stringToSign(String canonicalUri)
    {
        return String.join("\n",
                ALGORITHM,
                amzDate,
                credentialScope,
                Hashing.sha256().hashString(canonicalRequest(canonicalUri), UTF_8).toString());
    }
}
