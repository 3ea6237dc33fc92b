// Copyright 2024 The binwp Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package binwp.core;

import static binwp.core.BirFile.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.microsoft.z3.Context;

import binwp.core.Environment.FunSpec;
import binwp.core.Environment.FunSpecSelector;

public class EnvironmentTest {
	private Context ctx;

	@BeforeEach
	public void setup() {
		ctx = new Context();
	}

	@AfterEach
	public void teardown() {
		ctx.close();
	}

	@Test
	public void freshenedNamesCarryNamespace() {
		Environment orig = new Environment.Builder(ctx).build();
		Environment mod = new Environment.Builder(ctx).freshen(true).build();
		Var rax = Architecture.X86_64.findRegister("RAX");
		orig.initVar(rax);
		mod.initVar(rax);
		assertEquals("RAX", orig.mkVar(rax).toString());
		assertEquals("RAX_mod", mod.mkVar(rax).toString());
		assertEquals("init_RAX", orig.getInitVar(rax).toString());
		assertEquals("init_RAX_mod", mod.getInitVar(rax).toString());
		assertEquals(1, mod.getInitHypotheses().size());
	}

	@Test
	public void scopesHidePreconditions() {
		Environment env = new Environment.Builder(ctx).build();
		Tid blk = new Tid("blk");
		Constraint pre = env.trivialConstraint();
		env.addPrecondition(blk, pre);
		env.pushScope();
		assertNull(env.getPrecondition(blk));
		env.popScope();
		assertSame(pre, env.getPrecondition(blk));
		assertThrows(IllegalStateException.class, () -> env.popScope());
	}

	@Test
	public void negativeUnrollingIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new Environment.Builder(ctx).numUnroll(-1));
	}

	@Test
	public void firstMatchingSpecWins() {
		Subroutine f = new Subroutine(new Tid("@f"), "f", Collections.emptyList(), Collections.emptyList());
		Subroutine g = new Subroutine(new Tid("@g"), "g", Collections.emptyList(), Collections.emptyList());
		FunSpecSelector first = (sub, arch) -> sub.getName().equals("f") ? Optional.of(FunSpec.inline("first"))
				: Optional.empty();
		FunSpecSelector second = (sub, arch) -> Optional.of(FunSpec.inline("second"));
		Environment env = new Environment.Builder(ctx).subroutines(Arrays.asList(f, g))
				.specs(Arrays.asList(first, second)).build();
		assertEquals("first", env.getSubHandler(f).getName());
		assertEquals("second", env.getSubHandler(g).getName());
		assertSame(env.getSubHandler(f), env.getSubHandler(f));
	}

	@Test
	public void defaultSpecWhenNoneMatch() {
		Subroutine f = new Subroutine(new Tid("@f"), "f", Collections.emptyList(), Collections.emptyList());
		Environment env = new Environment.Builder(ctx).build();
		assertEquals("identity", env.getSubHandler(f).getName());
		assertFalse(env.getSubHandler(f).isInline());
	}

	@Test
	public void calledSymbolsAreNamespaced() {
		Environment mod = new Environment.Builder(ctx).freshen(true).namespace("patched").build();
		assertEquals("called_f_patched", mod.getCalled("f").toString());
		assertSame(mod.getCalled("f"), mod.getCalledSymbols().get("f"));
	}

	@Test
	public void findRegisterRejectsUnknownNames() {
		assertThrows(IllegalArgumentException.class, () -> Architecture.X86_64.findRegister("XMM0"));
		assertEquals("RSP", Architecture.X86_64.getStackPointer().getName());
		assertEquals(8, Architecture.X86_64.getAddressBytes());
		assertEquals(4, Architecture.ARM32.getAddressBytes());
	}
}
