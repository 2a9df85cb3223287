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

package org.statechannelj.utils;

import com.google.common.util.concurrent.CycleDetectingLockFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Various threading related utilities. Provides a wrapper around explicit lock creation that lets you control whether
 * lock cycle detection is enabled or not, and an executor that runs event listeners directly on the calling thread.
 */
public class Threading {

    /**
     * A dummy executor that just invokes the runnable immediately. Use this when you want an event listener to run
     * synchronously with the change that triggered it, while the originating lock is still held.
     */
    public static final Executor SAME_THREAD;

    static {
        throwOnLockCycles();
        SAME_THREAD = new Executor() {
            @Override
            public void execute(Runnable runnable) {
                runnable.run();
            }
        };
    }

    //////////////////////////////////////////////////////////////////////////////////////////////////////////////////

    public static CycleDetectingLockFactory factory;

    public static ReentrantLock lock(String name) {
        return factory.newReentrantLock(name);
    }

    public static void throwOnLockCycles() {
        setPolicy(CycleDetectingLockFactory.Policies.THROW);
    }

    public static void setPolicy(CycleDetectingLockFactory.Policy policy) {
        factory = CycleDetectingLockFactory.newInstance(policy);
    }
}
