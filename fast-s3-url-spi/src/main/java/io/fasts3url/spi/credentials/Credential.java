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
package io.fasts3url.spi.credentials;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Frozen AWS credentials. A {@link Temporary} credential carries an STS session token
 * which must be sent along with every signed request, a {@link Plain} one does not.
 * <p>
 * Instances are never refreshed. Temporary credentials usually expire and anything
 * signed with them afterward is rejected by the storage service.
 */
public sealed interface Credential
        permits Credential.Plain, Credential.Temporary
{
    String accessKey();

    String secretKey();

    Optional<String> session();

    static Credential of(String accessKey, String secretKey)
    {
        return new Plain(accessKey, secretKey);
    }

    static Credential of(String accessKey, String secretKey, Optional<String> session)
    {
        requireNonNull(session, "session is null");
        return session.filter(token -> !token.isEmpty())
                .<Credential>map(token -> new Temporary(accessKey, secretKey, token))
                .orElseGet(() -> new Plain(accessKey, secretKey));
    }

    record Plain(String accessKey, String secretKey)
            implements Credential
    {
        public Plain
        {
            requireNonNull(accessKey, "accessKey is null");
            requireNonNull(secretKey, "secretKey is null");
        }

        @Override
        public Optional<String> session()
        {
            return Optional.empty();
        }

        @Override
        public String toString()
        {
            return "Plain[accessKey=" + accessKey + ", secretKey=***]";
        }
    }

    record Temporary(String accessKey, String secretKey, String sessionToken)
            implements Credential
    {
        public Temporary
        {
            requireNonNull(accessKey, "accessKey is null");
            requireNonNull(secretKey, "secretKey is null");
            requireNonNull(sessionToken, "sessionToken is null");
            checkArgument(!sessionToken.isEmpty(), "sessionToken is empty");
        }

        @Override
        public Optional<String> session()
        {
            return Optional.of(sessionToken);
        }

        @Override
        public String toString()
        {
            return "Temporary[accessKey=" + accessKey + ", secretKey=***, sessionToken=***]";
        }
    }
}
