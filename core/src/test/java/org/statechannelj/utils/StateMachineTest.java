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

import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class StateMachineTest {
    private enum Phase { NEW, RUNNING, DONE }

    private StateMachine<Phase> machine;

    @Before
    public void setUp() {
        Multimap<Phase, Phase> transitions = MultimapBuilder.enumKeys(Phase.class).arrayListValues().build();
        transitions.put(Phase.NEW, Phase.RUNNING);
        transitions.put(Phase.NEW, Phase.DONE);
        transitions.put(Phase.RUNNING, Phase.DONE);
        machine = new StateMachine<>(Phase.NEW, transitions);
    }

    @Test
    public void followsDeclaredTransitions() {
        machine.checkState(Phase.NEW);
        machine.transition(Phase.RUNNING);
        assertEquals(Phase.RUNNING, machine.getState());
        machine.checkState(Phase.NEW, Phase.RUNNING);
        machine.transition(Phase.DONE);
        machine.checkState(Phase.RUNNING, Phase.DONE);
        assertEquals("[DONE]", machine.toString());
    }

    @Test
    public void refusesUndeclaredTransition() {
        machine.transition(Phase.DONE);
        try {
            machine.transition(Phase.RUNNING);
            fail();
        } catch (IllegalStateException e) {
            // expected
        }
        assertEquals(Phase.DONE, machine.getState());
    }

    @Test(expected = IllegalStateException.class)
    public void checkStateThrows() {
        machine.checkState(Phase.RUNNING);
    }

    @Test(expected = IllegalStateException.class)
    public void checkAnyStateThrows() {
        machine.checkState(Phase.RUNNING, Phase.DONE);
    }
}
