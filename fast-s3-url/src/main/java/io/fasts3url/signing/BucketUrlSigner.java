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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.airlift.log.Logger;
import io.fasts3url.spi.credentials.Credential;

import java.math.RoundingMode;
import java.nio.charset.CharsetEncoder;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.math.IntMath.divide;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Generates SigV4 presigned GET-object URLs for many keys of one bucket at once.
 * <p>
 * The endpoint is parsed once, at construction. Each call to
 * {@link #generatePresignedGetObjectUrls(List, Duration)} reads the clock and derives the
 * signing key and query string once, then only hashes and signs per key.
 * <p>
 * Credentials are never refreshed. When temporary credentials expire, URLs signed from then
 * on are rejected by the storage service and a new signer has to be created.
 * Instances are immutable and may be shared between threads.
 */
public class BucketUrlSigner
{
    private static final Logger log = Logger.get(BucketUrlSigner.class);

    public static final String DEFAULT_REGION = "us-east-1";
    public static final Duration DEFAULT_EXPIRY = Duration.ofHours(1);

    // https://docs.aws.amazon.com/AmazonS3/latest/API/sigv4-query-string-auth.html
    @VisibleForTesting
    static final Duration MAX_EXPIRY = Duration.ofDays(7);

    private final BucketLocation location;
    private final Credential credential;
    private final String region;
    private final Clock clock;
    private final Duration defaultExpiry;
    private final Optional<ParallelSigning> parallelSigning;

    public BucketUrlSigner(String bucketEndpointUrl, Credential credential)
    {
        this(bucketEndpointUrl, credential, Optional.empty());
    }

    public BucketUrlSigner(String bucketEndpointUrl, Credential credential, Optional<String> region)
    {
        this(BucketLocation.parse(bucketEndpointUrl), credential, region, Clock.systemUTC(), DEFAULT_EXPIRY, Optional.empty());
    }

    public BucketUrlSigner(
            BucketLocation location,
            Credential credential,
            Optional<String> region,
            Clock clock,
            Duration defaultExpiry,
            Optional<ParallelSigning> parallelSigning)
    {
        this.location = requireNonNull(location, "location is null");
        this.credential = requireNonNull(credential, "credential is null");
        this.region = requireNonNull(region, "region is null").filter(value -> !value.isEmpty()).orElse(DEFAULT_REGION);
        this.clock = requireNonNull(clock, "clock is null");
        this.defaultExpiry = validateExpiry(requireNonNull(defaultExpiry, "defaultExpiry is null"));
        this.parallelSigning = requireNonNull(parallelSigning, "parallelSigning is null");

        log.debug("Created signer. Endpoint: %s CanonicalUriPrefix: \"%s\" Region: %s AccessKey: %s SessionToken: %s",
                location.endpointUrl(), location.canonicalUriPrefix(), this.region, credential.accessKey(), credential.session().isPresent());
    }

    public BucketLocation location()
    {
        return location;
    }

    public String region()
    {
        return region;
    }

    public List<String> generatePresignedGetObjectUrls(List<String> objectKeys)
    {
        return generatePresignedGetObjectUrls(objectKeys, defaultExpiry);
    }

    public List<String> generatePresignedGetObjectUrls(List<String> objectKeys, long expiresInSeconds)
    {
        return generatePresignedGetObjectUrls(objectKeys, Duration.ofSeconds(expiresInSeconds));
    }

    /**
     * Returns one presigned URL per key, in the order of {@code objectKeys}.
     *
     * An empty {@code objectKeys} returns an empty list without looking at {@code expiresIn}.
     *
     * @throws IllegalArgumentException if any key is null, empty or not well-formed UTF-16
     * (an unpaired surrogate), or if {@code expiresIn} is not between one second and seven days.
     * Nothing is signed in that case.
     */
    public List<String> generatePresignedGetObjectUrls(List<String> objectKeys, Duration expiresIn)
    {
        requireNonNull(objectKeys, "objectKeys is null");
        requireNonNull(expiresIn, "expiresIn is null");

        if (objectKeys.isEmpty()) {
            return ImmutableList.of();
        }

        CharsetEncoder utf8 = UTF_8.newEncoder();
        for (int i = 0; i < objectKeys.size(); i++) {
            String objectKey = objectKeys.get(i);
            checkArgument(objectKey != null && !objectKey.isEmpty(), "All object keys must be non-empty strings. Invalid key at index %s", i);
            checkArgument(utf8.canEncode(objectKey), "Object key at index %s is not valid UTF-16 text", i);
        }
        validateExpiry(expiresIn);

        PresignBatch batch = PresignBatch.create(location, credential, region, clock.instant(), expiresIn);

        Optional<ParallelSigning> parallel = parallelSigning.filter(signing -> signing.appliesTo(objectKeys.size()));
        log.debug("Signing batch. Keys: %s Expiry: %s Date: %s Parallel: %s", objectKeys.size(), expiresIn, batch.amzDate(), parallel.isPresent());

        return parallel.map(signing -> presignInParallel(batch, objectKeys, signing))
                .orElseGet(() -> batch.presignAll(objectKeys));
    }

    private static List<String> presignInParallel(PresignBatch batch, List<String> objectKeys, ParallelSigning parallelSigning)
    {
        int chunkSize = divide(objectKeys.size(), parallelSigning.parallelism(), RoundingMode.CEILING);
        List<CompletableFuture<List<String>>> chunks = Lists.partition(objectKeys, chunkSize).stream()
                .map(chunk -> CompletableFuture.supplyAsync(() -> batch.presignAll(chunk), parallelSigning.executor()))
                .collect(toImmutableList());

        ImmutableList.Builder<String> urls = ImmutableList.builderWithExpectedSize(objectKeys.size());
        try {
            chunks.forEach(chunk -> urls.addAll(chunk.join()));
        }
        catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
        return urls.build();
    }

    private static Duration validateExpiry(Duration expiresIn)
    {
        long seconds = expiresIn.toSeconds();
        checkArgument(seconds >= 1 && seconds <= MAX_EXPIRY.toSeconds(), "Expiry must be between 1 and %s seconds: %s", MAX_EXPIRY.toSeconds(), expiresIn);
        return expiresIn;
    }
}
