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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static software.amazon.awssdk.utils.http.SdkHttpUtils.urlEncode;

/**
 * The signing query parameters of a presigned GET, everything but the signature itself.
 * Values are kept unencoded; {@link #toCanonicalQueryString()} encodes them.
 */
public record PresignQueryParameters(String credential, String amzDate, long expiresSeconds, Optional<String> securityToken)
{
    public static final String ALGORITHM = "AWS4-HMAC-SHA256";
    public static final String SIGNED_HEADERS = "host";

    public static final String X_AMZ_ALGORITHM = "X-Amz-Algorithm";
    public static final String X_AMZ_CREDENTIAL = "X-Amz-Credential";
    public static final String X_AMZ_DATE = "X-Amz-Date";
    public static final String X_AMZ_EXPIRES = "X-Amz-Expires";
    public static final String X_AMZ_SIGNED_HEADERS = "X-Amz-SignedHeaders";
    public static final String X_AMZ_SECURITY_TOKEN = "X-Amz-Security-Token";
    public static final String X_AMZ_SIGNATURE = "X-Amz-Signature";

    private static final Joiner AMPERSAND = Joiner.on('&');

    public PresignQueryParameters
    {
        requireNonNull(credential, "credential is null");
        requireNonNull(amzDate, "amzDate is null");
        requireNonNull(securityToken, "securityToken is null");
    }

    /**
     * The {@code &}-joined parameters, sorted by the full encoded {@code name=value} string.
     * This is both the canonical query string hashed into the canonical request and the
     * query of the final URL, with the signature appended after it.
     */
    public String toCanonicalQueryString()
    {
        ImmutableList.Builder<String> parameters = ImmutableList.<String>builder()
                .add(X_AMZ_ALGORITHM + "=" + ALGORITHM)
                .add(X_AMZ_CREDENTIAL + "=" + urlEncode(credential))
                .add(X_AMZ_DATE + "=" + amzDate)
                .add(X_AMZ_EXPIRES + "=" + expiresSeconds)
                .add(X_AMZ_SIGNED_HEADERS + "=" + SIGNED_HEADERS);
        securityToken.ifPresent(token -> parameters.add(X_AMZ_SECURITY_TOKEN + "=" + urlEncode(token)));

        // String ordering is UTF-16 code unit order which matches byte order for the ASCII of encoded values
        return AMPERSAND.join(Ordering.natural().sortedCopy(parameters.build()));
    }

    static String withSignature(String canonicalQueryString, String signature)
    {
        return canonicalQueryString + "&" + X_AMZ_SIGNATURE + "=" + signature;
    }
}
