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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestBucketLocation
{
    @Test
    public void testPathStyle()
    {
        BucketLocation location = BucketLocation.parse("https://s3.amazonaws.com/my-bucket/");
        assertThat(location.canonicalUriPrefix()).isEqualTo("/my-bucket");
        assertThat(location.endpointUrl()).isEqualTo("https://s3.amazonaws.com");
        assertThat(location.bucketHost()).isEqualTo("s3.amazonaws.com");
    }

    @Test
    public void testVirtualHostStyle()
    {
        BucketLocation location = BucketLocation.parse("https://my-bucket.s3.amazonaws.com/");
        assertThat(location.canonicalUriPrefix()).isEmpty();
        assertThat(location.endpointUrl()).isEqualTo("https://my-bucket.s3.amazonaws.com");
        assertThat(location.bucketHost()).isEqualTo("my-bucket.s3.amazonaws.com");
    }

    @Test
    public void testWithoutPath()
    {
        BucketLocation location = BucketLocation.parse("https://my-bucket.s3.us-west-2.amazonaws.com");
        assertThat(location.canonicalUriPrefix()).isEmpty();
        assertThat(location.endpointUrl()).isEqualTo("https://my-bucket.s3.us-west-2.amazonaws.com");
    }

    @Test
    public void testPortIsPartOfHost()
    {
        BucketLocation location = BucketLocation.parse("http://localhost:9000/bucket/");
        assertThat(location.canonicalUriPrefix()).isEqualTo("/bucket");
        assertThat(location.endpointUrl()).isEqualTo("http://localhost:9000");
        assertThat(location.bucketHost()).isEqualTo("localhost:9000");
    }

    @Test
    public void testTrailingSlashesAreStripped()
    {
        assertThat(BucketLocation.parse("http://localhost:9000/bucket///").canonicalUriPrefix()).isEqualTo("/bucket");
        assertThat(BucketLocation.parse("http://localhost:9000/bucket").canonicalUriPrefix()).isEqualTo("/bucket");
        assertThat(BucketLocation.parse("http://localhost:9000/proxy/bucket/").canonicalUriPrefix()).isEqualTo("/proxy/bucket");
    }

    @Test
    public void testCanonicalUri()
    {
        assertThat(BucketLocation.parse("https://s3.amazonaws.com/my-bucket/").canonicalUri("my/image.png")).isEqualTo("/my-bucket/my/image.png");
        assertThat(BucketLocation.parse("https://my-bucket.s3.amazonaws.com/").canonicalUri("my/image.png")).isEqualTo("/my/image.png");
    }

    @Test
    public void testMalformed()
    {
        assertThatThrownBy(() -> BucketLocation.parse("http://local host:9000/"))
                .isInstanceOf(MalformedEndpointException.class)
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BucketLocation.parse("/my-bucket/"))
                .isInstanceOf(MalformedEndpointException.class)
                .hasMessageContaining("absolute");
        assertThatThrownBy(() -> BucketLocation.parse("mailto:someone@example.com"))
                .isInstanceOf(MalformedEndpointException.class);
        assertThatThrownBy(() -> BucketLocation.parse("file:///tmp/bucket"))
                .isInstanceOf(MalformedEndpointException.class)
                .hasMessageContaining("no host");
        assertThatThrownBy(() -> BucketLocation.parse("https://s3.amazonaws.com/my-bucket/?versioning"))
                .isInstanceOf(MalformedEndpointException.class);
        assertThatThrownBy(() -> BucketLocation.parse(null))
                .isInstanceOf(NullPointerException.class);
    }
}
