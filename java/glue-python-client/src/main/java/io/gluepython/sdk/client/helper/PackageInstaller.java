/*
 * Copyright 2024 The Glue Python Client Authors
 *
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

package io.gluepython.sdk.client.helper;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.experimental.UtilityClass;

@UtilityClass
public class PackageInstaller {
    /**
     * Union of the packages declared in the model config and those found in its code.
     * Iteration order is not significant.
     */
    public static Set<String> merge(Collection<String> declared, Collection<String> scanned) {
        final Set<String> packages = new LinkedHashSet<>();
        Stream.of(declared, scanned)
                .filter(source -> source != null)
                .flatMap(Collection::stream)
                .filter(name -> name != null && !name.isBlank())
                .map(String::trim)
                .forEach(packages::add);
        return packages;
    }

    /**
     * Python code that pip-installs the packages into the session's interpreter.
     */
    public static String installStatement(Set<String> packages) {
        if (packages.isEmpty()) {
            throw new IllegalArgumentException("no packages to install");
        }
        final String names = packages.stream()
                .map(PackageInstaller::quote)
                .collect(Collectors.joining(", "));
        return "import subprocess, sys\n"
                + "subprocess.check_call([sys.executable, '-m', 'pip', 'install', " + names + ", '-q'])";
    }

    private static String quote(String name) {
        return '"' + name.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
