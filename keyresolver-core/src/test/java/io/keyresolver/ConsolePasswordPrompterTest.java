/*
 * Copyright 2024 Neil Madden.
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

package io.keyresolver;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;

import org.testng.annotations.Test;

public class ConsolePasswordPrompterTest {

    @Test
    public void shouldFailWithoutConsole() {
        var prompter = new ConsolePasswordPrompter(null);
        assertThatThrownBy(() -> prompter.promptPassword("Password"))
                .isInstanceOf(IOException.class)
                .hasMessage("no console available to prompt for a password");
    }

    @Test
    public void shouldSurfaceMissingConsoleAsSourceError() {
        var source = PasswordSource.prompt("Password", new ConsolePasswordPrompter(null));
        assertThatThrownBy(() -> source.obtain("key.enc"))
                .isInstanceOf(KeySourceException.class)
                .hasMessage("error reading password for key.enc: no console available to prompt for a password");
    }
}
