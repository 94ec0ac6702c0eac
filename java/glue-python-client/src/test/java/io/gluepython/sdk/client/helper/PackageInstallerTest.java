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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PackageInstallerTest {
    @Test
    public void testMergeIsDeduplicatingUnion() {
        final Set<String> merged = PackageInstaller.merge(Arrays.asList("a", "b"), Arrays.asList("b", "c"));

        assertEquals(new HashSet<>(Arrays.asList("a", "b", "c")), merged);
    }

    @Test
    public void testMergeIsIdempotent() {
        final Set<String> once = PackageInstaller.merge(Arrays.asList("a", "b"), Arrays.asList("b", "c"));
        final Set<String> twice = PackageInstaller.merge(once, once);

        assertEquals(once, twice);
    }

    @Test
    public void testMergeToleratesMissingSources() {
        assertTrue(PackageInstaller.merge(null, null).isEmpty());
        assertEquals(Collections.singleton("a"), PackageInstaller.merge(null, Collections.singletonList("a")));
        assertEquals(Collections.singleton("a"), PackageInstaller.merge(Arrays.asList("a", " ", null, " a "), null));
    }

    @Test
    public void testInstallStatement() {
        final String code = PackageInstaller.installStatement(new LinkedHashSet<>(Arrays.asList("pandas", "numpy>=1.26")));

        assertEquals("import subprocess, sys\n"
                + "subprocess.check_call([sys.executable, '-m', 'pip', 'install', \"pandas\", \"numpy>=1.26\", '-q'])",
                code);
    }

    @Test
    public void testInstallStatementEscapesNames() {
        final String code = PackageInstaller.installStatement(Collections.singleton("evil\"); print(\"x"));

        assertTrue(code.contains("\"evil\\\"); print(\\\"x\""));
    }

    @Test
    public void testInstallStatementRequiresPackages() {
        assertThrows(IllegalArgumentException.class, () -> PackageInstaller.installStatement(Collections.emptySet()));
    }
}
