package io.github.goodees.choreo.matching;

/*-
 * #%L
 * choreo
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TypeSwitchTest {

    @Test
    public void first_matching_branch_wins() {
        List<String> calls = new ArrayList<>();
        TypeSwitch sw = TypeSwitch.builder()
                .on(Integer.class, i -> i > 10, i -> calls.add("big"))
                .on(Integer.class, i -> calls.add("int"))
                .on(Number.class, n -> calls.add("number"))
                .build();

        assertTrue(sw.executeMatching(42));
        assertTrue(sw.executeMatching(1));
        assertTrue(sw.executeMatching(1L));
        assertFalse(sw.executeMatching("text"));
        assertFalse(sw.executeMatching(null));
        assertThat(calls, contains("big", "int", "number"));
    }

    @Test
    public void fallback_is_evaluated_last() {
        List<String> calls = new ArrayList<>();
        TypeSwitch sw = TypeSwitch.builder()
                .otherwise(o -> calls.add("other"))
                .on(String.class, s -> calls.add("string"))
                .build();

        sw.executeMatching("text");
        sw.executeMatching(1);
        assertThat(calls, contains("string", "other"));
    }
}
