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

import com.google.common.base.CharMatcher;

import java.net.URI;
import java.net.URISyntaxException;

import static java.util.Objects.requireNonNull;

/**
 * The parts of a bucket endpoint URL that end up in a presigned URL.
 *
 * @param endpointUrl scheme and authority only, e.g. {@code https://s3.amazonaws.com}
 * @param canonicalUriPrefix the endpoint path without trailing slashes: empty for
 * virtual-hosted endpoints, {@code /my-bucket} for path-style ones
 * @param bucketHost host and optional port, used both in the {@code host} signed header and in the URL
 */
public record BucketLocation(String endpointUrl, String canonicalUriPrefix, String bucketHost)
{
    private static final CharMatcher SLASH = CharMatcher.is('/');

    public BucketLocation
    {
        requireNonNull(endpointUrl, "endpointUrl is null");
        requireNonNull(canonicalUriPrefix, "canonicalUriPrefix is null");
        requireNonNull(bucketHost, "bucketHost is null");
    }

    public static BucketLocation parse(String bucketEndpointUrl)
    {
        requireNonNull(bucketEndpointUrl, "bucketEndpointUrl is null");

        URI uri;
        try {
            uri = new URI(bucketEndpointUrl);
        }
        catch (URISyntaxException e) {
            throw new MalformedEndpointException(bucketEndpointUrl, e);
        }

        if (!uri.isAbsolute() || uri.isOpaque()) {
            throw new MalformedEndpointException(bucketEndpointUrl, "not an absolute hierarchical URL");
        }
        String authority = uri.getRawAuthority();
        if (authority == null || authority.isEmpty()) {
            throw new MalformedEndpointException(bucketEndpointUrl, "no host");
        }
        if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new MalformedEndpointException(bucketEndpointUrl, "query and fragment are not allowed");
        }

        String path = (uri.getRawPath() == null) ? "" : uri.getRawPath();
        return new BucketLocation(uri.getScheme() + "://" + authority, SLASH.trimTrailingFrom(path), authority);
    }

    String canonicalUri(String encodedObjectKey)
    {
        return canonicalUriPrefix + "/" + encodedObjectKey;
    }
}
