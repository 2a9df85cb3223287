/*
 * Copyright by the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.statechannelj.params;

/**
 * Network parameters used by the statechannelj unit tests (and potentially your own). The chain id is the one local
 * development chains conventionally use.
 */
public class UnitTestParams extends NetworkParameters {
    public static final long UNITTEST_CHAIN_ID = 1337;

    public UnitTestParams() {
        super();
        id = ID_UNITTESTNET;
        chainId = UNITTEST_CHAIN_ID;
    }

    private static UnitTestParams instance;
    public static synchronized UnitTestParams get() {
        if (instance == null) {
            instance = new UnitTestParams();
        }
        return instance;
    }
}
