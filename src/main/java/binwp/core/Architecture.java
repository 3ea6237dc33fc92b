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

import static binwp.core.BirFile.MEMORY;
import static binwp.core.BirFile.REG;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import binwp.core.BirFile.Endian;
import binwp.core.BirFile.Var;

/**
 * Describes the register file and calling convention of a target architecture.
 * The predefined architectures cover the registers the lifter produces for the
 * System V (x86), cdecl (x86-32) and AAPCS (ARM) conventions. Other
 * architectures can be described with a {@link Builder}.
 */
public class Architecture {
	private static final Var[] X86_64_GPRS = {
			REG("RAX", 64), REG("RBX", 64), REG("RCX", 64), REG("RDX", 64), REG("RSI", 64), REG("RDI", 64),
			REG("RSP", 64), REG("RBP", 64), REG("R8", 64), REG("R9", 64), REG("R10", 64), REG("R11", 64),
			REG("R12", 64), REG("R13", 64), REG("R14", 64), REG("R15", 64) };

	private static final Var[] X86_FLAGS = { REG("CF", 1), REG("PF", 1), REG("AF", 1), REG("ZF", 1), REG("SF", 1),
			REG("OF", 1), REG("DF", 1) };

	public static final Architecture X86_64 = new Builder("x86_64", 64)
			.registers(X86_64_GPRS)
			.registers(X86_FLAGS)
			.inputs("RDI", "RSI", "RDX", "RCX", "R8", "R9")
			.callerSaved("RAX", "RCX", "RDX", "RSI", "RDI", "R8", "R9", "R10", "R11")
			.calleeSaved("RBX", "RSP", "RBP", "R12", "R13", "R14", "R15")
			.stackPointer("RSP")
			.returnRegister("RAX")
			.x86(true)
			.build();

	public static final Architecture X86_32 = new Builder("x86_32", 32)
			.registers(REG("EAX", 32), REG("EBX", 32), REG("ECX", 32), REG("EDX", 32), REG("ESI", 32),
					REG("EDI", 32), REG("ESP", 32), REG("EBP", 32))
			.registers(X86_FLAGS)
			// Arguments are passed on the stack, so the stack pointer determines them.
			.inputs("ESP")
			.callerSaved("EAX", "ECX", "EDX")
			.calleeSaved("EBX", "ESI", "EDI", "ESP", "EBP")
			.stackPointer("ESP")
			.returnRegister("EAX")
			.x86(true)
			.build();

	public static final Architecture ARM32 = new Builder("arm", 32)
			.registers(REG("R0", 32), REG("R1", 32), REG("R2", 32), REG("R3", 32), REG("R4", 32), REG("R5", 32),
					REG("R6", 32), REG("R7", 32), REG("R8", 32), REG("R9", 32), REG("R10", 32), REG("R11", 32),
					REG("R12", 32), REG("SP", 32), REG("LR", 32), REG("PC", 32))
			.registers(REG("NF", 1), REG("ZF", 1), REG("CF", 1), REG("VF", 1))
			.inputs("R0", "R1", "R2", "R3")
			.callerSaved("R0", "R1", "R2", "R3", "R12", "LR")
			.calleeSaved("R4", "R5", "R6", "R7", "R8", "R9", "R10", "R11", "SP")
			.stackPointer("SP")
			.returnRegister("R0")
			.build();

	private final String name;
	private final int addressWidth;
	private final Endian endian;
	private final List<Var> registers;
	private final List<Var> inputs;
	private final List<Var> callerSaved;
	private final List<Var> calleeSaved;
	private final Var stackPointer;
	private final Var returnRegister;
	private final Var memory;
	private final boolean x86;

	private Architecture(Builder builder) {
		this.name = builder.name;
		this.addressWidth = builder.addressWidth;
		this.endian = builder.endian;
		this.registers = Collections.unmodifiableList(new ArrayList<>(builder.registers));
		this.memory = MEMORY(builder.memoryName, addressWidth, 8);
		this.inputs = lookup(builder.inputs);
		this.callerSaved = lookup(builder.callerSaved);
		this.calleeSaved = lookup(builder.calleeSaved);
		this.stackPointer = builder.stackPointer == null ? null : findRegister(builder.stackPointer);
		this.returnRegister = builder.returnRegister == null ? null : findRegister(builder.returnRegister);
		this.x86 = builder.x86;
	}

	public String getName() {
		return name;
	}

	public int getAddressWidth() {
		return addressWidth;
	}

	/**
	 * The number of bytes in a machine address.
	 *
	 * @return
	 */
	public int getAddressBytes() {
		return addressWidth / 8;
	}

	public Endian getEndian() {
		return endian;
	}

	/**
	 * The general purpose registers and flags of this architecture.
	 *
	 * @return
	 */
	public List<Var> getRegisters() {
		return registers;
	}

	/**
	 * The registers used to pass arguments to a function.
	 *
	 * @return
	 */
	public List<Var> getInputRegisters() {
		return inputs;
	}

	public List<Var> getCallerSavedRegisters() {
		return callerSaved;
	}

	public List<Var> getCalleeSavedRegisters() {
		return calleeSaved;
	}

	public Var getStackPointer() {
		return stackPointer;
	}

	public Var getReturnRegister() {
		return returnRegister;
	}

	public Var getMemory() {
		return memory;
	}

	/**
	 * Check whether a call on this architecture pushes its return address to the
	 * stack, and hence whether the callee pops it on return.
	 *
	 * @return
	 */
	public boolean isX86() {
		return x86;
	}

	/**
	 * Find a register by name.
	 *
	 * @param name
	 * @return
	 * @throws IllegalArgumentException if no such register exists.
	 */
	public Var findRegister(String name) {
		for (Var v : registers) {
			if (v.getName().equals(name)) {
				return v;
			}
		}
		if (name.equals(memory.getName())) {
			return memory;
		}
		throw new IllegalArgumentException("Could not find " + name + " in the registers of " + this.name);
	}

	@Override
	public String toString() {
		return name;
	}

	private List<Var> lookup(List<String> names) {
		ArrayList<Var> vars = new ArrayList<>();
		for (String n : names) {
			vars.add(findRegister(n));
		}
		return Collections.unmodifiableList(vars);
	}

	public static class Builder {
		private final String name;
		private final int addressWidth;
		private Endian endian = Endian.LITTLE;
		private final List<Var> registers = new ArrayList<>();
		private List<String> inputs = Collections.emptyList();
		private List<String> callerSaved = Collections.emptyList();
		private List<String> calleeSaved = Collections.emptyList();
		private String stackPointer;
		private String returnRegister;
		private String memoryName = "mem";
		private boolean x86;

		public Builder(String name, int addressWidth) {
			this.name = Objects.requireNonNull(name);
			this.addressWidth = addressWidth;
		}

		public Builder endian(Endian endian) {
			this.endian = endian;
			return this;
		}

		public Builder registers(Var... registers) {
			this.registers.addAll(Arrays.asList(registers));
			return this;
		}

		public Builder inputs(String... names) {
			this.inputs = Arrays.asList(names);
			return this;
		}

		public Builder callerSaved(String... names) {
			this.callerSaved = Arrays.asList(names);
			return this;
		}

		public Builder calleeSaved(String... names) {
			this.calleeSaved = Arrays.asList(names);
			return this;
		}

		public Builder stackPointer(String name) {
			this.stackPointer = name;
			return this;
		}

		public Builder returnRegister(String name) {
			this.returnRegister = name;
			return this;
		}

		public Builder memory(String name) {
			this.memoryName = name;
			return this;
		}

		public Builder x86(boolean flag) {
			this.x86 = flag;
			return this;
		}

		public Architecture build() {
			return new Architecture(this);
		}
	}
}
