/*
 * Copyright 2026 The binary-symbolic-engine Authors
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

package symbolicengine;

import junit.framework.TestCase;

import java.math.BigInteger;

public class CallbacksTest extends TestCase {
  private AnalysisContext context;

  @Override
  protected void setUp() {
    context = new AnalysisContext();
    context.setArchitecture(GenericCpu.x86_64());
  }

  public void testMemoryReadCallbackCanMaterializeMemory() {
    context.addCallback(new GetConcreteMemoryValueCallback() {
      @Override
      public void onConcreteMemoryRead(AnalysisContext ctx,
          MemoryAccess memory) {
        for (int i = 0; i < memory.getSize(); i++) {
          long address = memory.getAddress() + i;
          if (!ctx.isMemoryMapped(address, 1)) {
            ctx.setConcreteMemoryValue(address, 0x90);
          }
        }
      }
    });
    assertEquals(0x90, context.getConcreteMemoryValue(0x4000));
    assertEquals(BigInteger.valueOf(0x9090),
        context.getConcreteMemoryValue(new MemoryAccess(0x5000, 2)));
  }

  public void testCallbacksAreSkippedOnRequest() {
    final int[] calls = new int[1];
    context.addCallback(new GetConcreteRegisterValueCallback() {
      @Override
      public void onConcreteRegisterRead(AnalysisContext ctx,
          Register register) {
        calls[0]++;
      }
    });
    Register rax = context.getRegister("rax");
    context.getConcreteRegisterValue(rax);
    context.getConcreteRegisterValue(rax, false);
    assertEquals(1, calls[0]);
  }

  public void testSymbolicReadOfConcreteRegisterGoesThroughCallbacks() {
    context.addCallback(new GetConcreteRegisterValueCallback() {
      @Override
      public void onConcreteRegisterRead(AnalysisContext ctx,
          Register register) {
        ctx.setConcreteRegisterValue(register, BigInteger.valueOf(42));
      }
    });
    AstNode node = context.getRegisterAst(context.getRegister("rcx"));
    assertEquals(BigInteger.valueOf(42), node.evaluate());
  }

  public void testInvocationFollowsRegistrationOrder() {
    final StringBuilder order = new StringBuilder();
    for (final char name : new char[] {'x', 'y', 'z'}) {
      context.addCallback(new GetConcreteRegisterValueCallback() {
        @Override
        public void onConcreteRegisterRead(AnalysisContext ctx,
            Register register) {
          order.append(name);
        }
      });
    }
    context.getConcreteRegisterValue(context.getRegister("rax"));
    assertEquals("xyz", order.toString());
  }

  public void testRemovalByHandle() {
    Callbacks callbacks = context.getCallbacks();
    SymbolicSimplificationCallback identity =
        new SymbolicSimplificationCallback() {
          @Override
          public AstNode simplify(AnalysisContext ctx, AstNode node) {
            return node;
          }
        };
    CallbackHandle first = context.addCallback(identity);
    CallbackHandle second = context.addCallback(identity);
    assertFalse(first.equals(second));
    assertEquals(2, callbacks.count(CallbackKind.SYMBOLIC_SIMPLIFICATION));
    assertTrue(context.removeCallback(first));
    assertFalse(context.removeCallback(first));
    assertEquals(1, callbacks.count(CallbackKind.SYMBOLIC_SIMPLIFICATION));
    assertTrue(callbacks.isDefined(CallbackKind.SYMBOLIC_SIMPLIFICATION));
    assertFalse(callbacks.isDefined(CallbackKind.GET_CONCRETE_MEMORY_VALUE));
    context.removeAllCallbacks();
    assertFalse(callbacks.isDefined(CallbackKind.SYMBOLIC_SIMPLIFICATION));
    assertFalse(context.removeCallback(second));
  }

  public void testSimplificationMustReturnANode() {
    context.addCallback(new SymbolicSimplificationCallback() {
      @Override
      public AstNode simplify(AnalysisContext ctx, AstNode node) {
        return null;
      }
    });
    try {
      context.newSymbolicExpression(context.getAstContext().bv(1, 8), null);
      fail("Should have thrown EngineException");
    } catch (EngineException expected) {
    }
  }
}
