/*
 * Copyright 2021 Netflix, Inc.
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

package io.devpodctl.common.util.log;

public enum AnsiColor {
    Blue("34"),
    Green("32"),
    Yellow("33"),
    Magenta("35"),
    Cyan("36"),
    BoldWhite("1;37");

    private static final String ESCAPE = "\u001B[";
    private static final String RESET = ESCAPE + "0m";

    private final String code;

    AnsiColor(String code) {
        this.code = code;
    }

    public String colorize(String text) {
        return ESCAPE + code + 'm' + text + RESET;
    }
}
