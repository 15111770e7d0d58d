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
package io.fasts3url.awssdk;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.BaseEncoding;
import io.airlift.log.Logger;
import io.fasts3url.spi.endpoint.BucketEndpoint;
import io.fasts3url.spi.endpoint.BucketEndpointProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.security.SecureRandom;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Discovers where a bucket lives by letting an {@link S3Presigner} sign one throw-away
 * object key and cutting the resulting URL at that key. Whatever endpoint override,
 * addressing style or FIPS/dual-stack setting the presigner carries is reflected in the
 * discovered URL.
 */
public class S3PresignerBucketEndpointProvider
        implements BucketEndpointProvider
{
    private static final Logger log = Logger.get(S3PresignerBucketEndpointProvider.class);

    private static final Duration DISCOVERY_EXPIRY = Duration.ofMinutes(1);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final S3Presigner presigner;
    private final String bucket;
    private final Region region;

    public S3PresignerBucketEndpointProvider(S3Presigner presigner, String bucket, Region region)
    {
        this.presigner = requireNonNull(presigner, "presigner is null");
        this.bucket = requireNonNull(bucket, "bucket is null");
        this.region = requireNonNull(region, "region is null");
    }

    @Override
    public BucketEndpoint bucketEndpoint()
    {
        String dummyKey = dummyKey();
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(DISCOVERY_EXPIRY)
                .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(dummyKey).build())
                .build();
        String presignedUrl = presigner.presignGetObject(presignRequest).url().toString();

        BucketEndpoint endpoint = new BucketEndpoint(truncateAtKey(presignedUrl, dummyKey), region.id());
        log.debug("Discovered endpoint %s for bucket %s", endpoint.bucketEndpointUrl(), bucket);
        return endpoint;
    }

    @VisibleForTesting
    static String truncateAtKey(String presignedUrl, String dummyKey)
    {
        int index = presignedUrl.indexOf(dummyKey);
        if (index < 0) {
            throw new IllegalStateException("Presigned URL does not contain the object key %s: %s".formatted(dummyKey, presignedUrl.split("\\?", 2)[0]));
        }
        return presignedUrl.substring(0, index);
    }

    @VisibleForTesting
    static String dummyKey()
    {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }
}
