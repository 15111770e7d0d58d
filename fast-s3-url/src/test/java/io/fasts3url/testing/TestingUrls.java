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
package io.fasts3url.testing;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

import java.net.URI;
import java.util.List;

import static software.amazon.awssdk.utils.http.SdkHttpUtils.urlDecode;

public final class TestingUrls
{
    private static final Splitter AMPERSAND = Splitter.on('&');
    private static final Splitter EQUALS = Splitter.on('=').limit(2);

    private TestingUrls() {}

    // decoded query parameters of a URL, in URL order
    public static ImmutableMap<String, String> queryParameters(String url)
    {
        String rawQuery = URI.create(url).getRawQuery();
        ImmutableMap.Builder<String, String> parameters = ImmutableMap.builder();
        AMPERSAND.split(rawQuery).forEach(parameter -> {
            List<String> nameAndValue = EQUALS.splitToList(parameter);
            parameters.put(urlDecode(nameAndValue.get(0)), urlDecode(nameAndValue.get(1)));
        });
        return parameters.buildOrThrow();
    }

    public static List<String> queryParameterNames(String url)
    {
        return queryParameters(url).keySet().asList();
    }
}
