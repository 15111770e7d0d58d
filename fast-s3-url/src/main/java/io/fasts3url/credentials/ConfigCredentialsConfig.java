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
package io.fasts3url.credentials;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigSecuritySensitive;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.Optional;

public class ConfigCredentialsConfig
{
    private String accessKey;
    private String secretKey;
    private Optional<String> sessionToken = Optional.empty();

    @NotNull
    @NotEmpty
    public String getAccessKey()
    {
        return accessKey;
    }

    @Config("credentials.access-key")
    public ConfigCredentialsConfig setAccessKey(String accessKey)
    {
        this.accessKey = accessKey;
        return this;
    }

    @NotNull
    @NotEmpty
    public String getSecretKey()
    {
        return secretKey;
    }

    @ConfigSecuritySensitive
    @Config("credentials.secret-key")
    public ConfigCredentialsConfig setSecretKey(String secretKey)
    {
        this.secretKey = secretKey;
        return this;
    }

    @NotNull
    public Optional<String> getSessionToken()
    {
        return sessionToken;
    }

    @ConfigSecuritySensitive
    @Config("credentials.session-token")
    public ConfigCredentialsConfig setSessionToken(String sessionToken)
    {
        this.sessionToken = Optional.ofNullable(sessionToken);
        return this;
    }
}
