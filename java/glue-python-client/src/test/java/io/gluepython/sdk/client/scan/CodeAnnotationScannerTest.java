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

package io.gluepython.sdk.client.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class CodeAnnotationScannerTest {
    @Test
    public void testExtractsPackagesInSourceOrder() {
        final String code = "dbt.config(packages=[\"a\", \"b\"])\n";

        assertEquals(Arrays.asList("a", "b"), CodeAnnotationScanner.extractPackages(code));
    }

    @Test
    public void testExtractsFromCompiledModel() {
        final String code = String.join("\n",
                "import pandas as pd",
                "",
                "",
                "def model(dbt, session):",
                "    dbt.config(",
                "        materialized='table',",
                "        packages=['pandas==2.1.0', \"scikit-learn\"],  # pinned",
                "    )",
                "    df = dbt.ref(\"upstream\").toPandas()",
                "    return df[df['x'] > 0]",
                "",
                "",
                "# This part is user provided model code",
                "class config:",
                "    def __init__(self, *args, **kwargs):",
                "        pass",
                "",
                "    @staticmethod",
                "    def get(key, default=None):",
                "        return config_dict.get(key, default)",
                "",
                "class this:",
                "    \"\"\"dbt.this() or dbt.this.identifier\"\"\"",
                "    database = \"awsdatacatalog\"",
                "    schema = \"analytics\"",
                "    identifier = \"my_model\"",
                "    def __repr__(self):",
                "        return f'{self.schema}.{self.identifier}'",
                "",
                "",
                "class dbtObj:",
                "    def __init__(self, load_df_function) -> None:",
                "        self.source = lambda *args: source(*args, dbt_load_df_function=load_df_function)",
                "        self.ref = lambda *args, **kwargs: ref(*args, **kwargs, dbt_load_df_function=load_df_function)",
                "        self.config = config",
                "        self.this = this()",
                "        self.is_incremental = False",
                "");

        assertEquals(Arrays.asList("pandas==2.1.0", "scikit-learn"), CodeAnnotationScanner.extractPackages(code));
    }

    @Test
    public void testNoConfigCall() {
        final String code = "def model(dbt, session):\n    return session.sql('select 1')\n";

        assertTrue(CodeAnnotationScanner.extractPackages(code).isEmpty());
    }

    @Test
    public void testMalformedSourceYieldsNothing() {
        final String code = "def model(dbt, session:\n    dbt.config(packages=['a'])\n";

        assertTrue(CodeAnnotationScanner.extractPackages(code).isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("dbt.config(packages=['a']").isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("dbt.config(packages=['a'])\n  $").isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages(null).isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("").isEmpty());
    }

    @Test
    public void testPackagesMustBeListLiteral() {
        assertTrue(CodeAnnotationScanner.extractPackages("pkgs = ['a']\ndbt.config(packages=pkgs)\n").isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("dbt.config(packages=('a', 'b'))\n").isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("dbt.config(packages=[p for p in 'ab'])\n").isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("dbt.config(packages=['a'] + ['b'])\n").isEmpty());
    }

    @Test
    public void testOnlyTheConfigNamespaceMatches() {
        assertTrue(CodeAnnotationScanner.extractPackages("other.config(packages=['a'])\n").isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("dbt.configure(packages=['a'])\n").isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("config(packages=['a'])\n").isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("x.dbt.config(packages=['a'])\n").isEmpty());
        assertTrue(CodeAnnotationScanner.extractPackages("dbt.config(['a'])\n").isEmpty());
    }

    @Test
    public void testSkipsConfigCallsWithoutPackageList() {
        final String code = "dbt.config(materialized='table')\n"
                + "dbt.config(packages=unknown)\n"
                + "dbt.config(packages=['late'])\n";

        assertEquals(Collections.singletonList("late"), CodeAnnotationScanner.extractPackages(code));
    }

    @Test
    public void testFirstPackageListWins() {
        final String code = "dbt.config(packages=['first'])\ndbt.config(packages=['second'])\n";

        assertEquals(Collections.singletonList("first"), CodeAnnotationScanner.extractPackages(code));
    }

    @Test
    public void testEmptyList() {
        assertTrue(CodeAnnotationScanner.extractPackages("dbt.config(packages=[])\n").isEmpty());
    }

    @Test
    public void testDecodesStringLiterals() {
        final String code = "dbt.config(packages=[\n"
                + "    'py' 'arrow',\n"
                + "    r'C:\\raw',\n"
                + "    \"tab\\there\",\n"
                + "    '''triple''',\n"
                + "    'caf\\u00e9',\n"
                + "    1,\n"
                + "    b'bytes',\n"
                + "    f'{name}',\n"
                + "    name,\n"
                + "])";

        final List<String> packages = CodeAnnotationScanner.extractPackages(code);

        assertEquals(Arrays.asList("pyarrow", "C:\\raw", "tab\there", "triple", "café"), packages);
    }

    @Test
    public void testParsesWithoutTrailingNewline() {
        assertFalse(CodeAnnotationScanner.extractPackages("dbt.config(packages=['a'])").isEmpty());
        assertFalse(CodeAnnotationScanner.extractPackages("if True:\n    dbt.config(packages=['a'])\n    \n").isEmpty());
    }

    @Test
    public void testExtractsNextToMatchStatement() {
        final String code = String.join("\n",
                "def model(dbt, session):",
                "    dbt.config(packages=['pandas'])",
                "    match session.conf.get('mode'):",
                "        case 'full' | 'FULL' as mode:",
                "            pass",
                "        case [first, *rest] if first:",
                "            pass",
                "        case {'kind': kind, **others}:",
                "            pass",
                "        case Point(x=0, y=_) | pkg.Const:",
                "            pass",
                "        case -1 | 1+2j | None:",
                "            pass",
                "        case _:",
                "            pass",
                "    match = re.match('a', 'b')",
                "    type = match.type",
                "    return match",
                "");

        assertEquals(Collections.singletonList("pandas"), CodeAnnotationScanner.extractPackages(code));
    }

    @Test
    public void testExtractsNextToParenthesizedWith() {
        final String code = String.join("\n",
                "def model(dbt, session):",
                "    with (",
                "        open('a') as a,",
                "        open('b') as b,",
                "    ):",
                "        pass",
                "    with (open('c')) as c, open('d'):",
                "        pass",
                "    dbt.config(packages=['pandas'])",
                "");

        assertEquals(Collections.singletonList("pandas"), CodeAnnotationScanner.extractPackages(code));
    }

    @Test
    public void testExtractsNextToExceptionGroupsAndStarSubscripts() {
        final String code = String.join("\n",
                "def model(dbt, session):",
                "    dbt.config(packages=['pandas'])",
                "    try:",
                "        rows = table[*keys]",
                "    except* ValueError as group:",
                "        pass",
                "    for item in *head, *tail:",
                "        pass",
                "");

        assertEquals(Collections.singletonList("pandas"), CodeAnnotationScanner.extractPackages(code));
    }

    @Test
    public void testExtractsNextToTypeStatementsAndGenerics() {
        final String code = String.join("\n",
                "type Rows[T] = list[T]",
                "",
                "class Box[T: int, *Ts, **P]:",
                "    pass",
                "",
                "def first[T](items: list[T]) -> T:",
                "    return items[0]",
                "",
                "def model(dbt, session):",
                "    dbt.config(packages=['pandas'])",
                "    return type(session)",
                "");

        assertEquals(Collections.singletonList("pandas"), CodeAnnotationScanner.extractPackages(code));
    }

    @Test
    public void testExtractsNextToFormatStrings() {
        final String code = String.join("\n",
                "def model(dbt, session):",
                "    conf = {'key': 'v'}",
                "    a = f\"{conf[\"key\"]}\"",
                "    b = f'{conf['key']!r:>{10}} {{literal}}'",
                "    c = rf\"\\d{a + f'{b}'}\"",
                "    d = f\"\"\"{ {'x': 1}['x'] }",
                "    \"\"\"",
                "    dbt.config(packages=['pandas', f'{a}'])",
                "");

        assertEquals(Collections.singletonList("pandas"), CodeAnnotationScanner.extractPackages(code));
    }
}
