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

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * SigV4 signing key derivation, see
 * <a href="https://docs.aws.amazon.com/IAM/latest/UserGuide/create-signed-request.html">create-signed-request</a>.
 */
final class SigningKeys
{
    static final String HMAC_SHA256 = "HmacSHA256";
    static final String TERMINATOR = "aws4_request";

    private SigningKeys() {}

    static byte[] deriveSigningKey(String secretKey, String dateStamp, String region, String service)
    {
        byte[] dateKey = hmacSha256(("AWS4" + secretKey).getBytes(UTF_8), dateStamp);
        byte[] regionKey = hmacSha256(dateKey, region);
        byte[] serviceKey = hmacSha256(regionKey, service);
        return hmacSha256(serviceKey, TERMINATOR);
    }

    static String credentialScope(String dateStamp, String region, String service)
    {
        return dateStamp + "/" + region + "/" + service + "/" + TERMINATOR;
    }

    static byte[] hmacSha256(byte[] key, String data)
    {
        return newMac(key).doFinal(data.getBytes(UTF_8));
    }

    // Mac instances are not thread safe, callers keep one per thread
    static Mac newMac(byte[] key)
    {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(key, HMAC_SHA256));
            return mac;
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
        catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
