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

import com.google.common.collect.ImmutableList;
import io.fasts3url.signing.BucketUrlSigner;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.TestInstance.Lifecycle.PER_CLASS;

@TestInstance(PER_CLASS)
public class TestAwsSdkBucketUrlSigners
{
    private static final AwsCredentialsProvider CREDENTIALS = StaticCredentialsProvider.create(AwsBasicCredentials.create("ACCESS", "SuperS3cret"));

    private S3Presigner presigner;

    @BeforeAll
    public void setUp()
    {
        presigner = S3Presigner.builder()
                .region(Region.EU_WEST_1)
                .credentialsProvider(CREDENTIALS)
                .endpointOverride(URI.create("http://localhost:9000"))
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .build();
    }

    @AfterAll
    public void tearDown()
    {
        presigner.close();
    }

    @Test
    public void testFromPresigner()
    {
        BucketUrlSigner signer = AwsSdkBucketUrlSigners.fromPresigner(presigner, "bucket", Region.EU_WEST_1, CREDENTIALS);

        assertThat(signer.region()).isEqualTo("eu-west-1");
        assertThat(signer.location().endpointUrl()).isEqualTo("http://localhost:9000");
        assertThat(signer.location().canonicalUriPrefix()).isEqualTo("/bucket");

        List<String> urls = signer.generatePresignedGetObjectUrls(ImmutableList.of("cat.jpg", "dir/dog.png"), 300);
        assertThat(urls).hasSize(2);
        assertThat(urls.get(0)).startsWith("http://localhost:9000/bucket/cat.jpg?X-Amz-Algorithm=AWS4-HMAC-SHA256&X-Amz-Credential=ACCESS%2F");
        assertThat(urls.get(1)).startsWith("http://localhost:9000/bucket/dir/dog.png?");
        assertThat(urls).allSatisfy(url -> assertThat(url).contains("%2Feu-west-1%2Fs3%2Faws4_request&"));
    }

    @Test
    public void testFromPresignerAsync()
    {
        AwsCredentialsProvider session = StaticCredentialsProvider.create(AwsSessionCredentials.create("ACCESS", "SuperS3cret", "token"));
        BucketUrlSigner signer = AwsSdkBucketUrlSigners.fromPresignerAsync(presigner, "bucket", Region.EU_WEST_1, session).join();

        assertThat(signer.generatePresignedGetObjectUrls(ImmutableList.of("cat.jpg")).get(0))
                .startsWith("http://localhost:9000/bucket/cat.jpg?")
                .contains("&X-Amz-Security-Token=token&");
    }
}
