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
package io.fasts3url.spi.endpoint;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Where a bucket lives: an absolute URL that object keys are appended to, either
 * virtual-hosted ({@code https://my-bucket.s3.amazonaws.com/}) or path style
 * ({@code https://s3.amazonaws.com/my-bucket/}), and the region to sign for.
 */
public record BucketEndpoint(String bucketEndpointUrl, Optional<String> region)
{
    public BucketEndpoint
    {
        requireNonNull(bucketEndpointUrl, "bucketEndpointUrl is null");
        requireNonNull(region, "region is null");
    }

    public BucketEndpoint(String bucketEndpointUrl)
    {
        this(bucketEndpointUrl, Optional.empty());
    }

    public BucketEndpoint(String bucketEndpointUrl, String region)
    {
        this(bucketEndpointUrl, Optional.of(region));
    }
}
