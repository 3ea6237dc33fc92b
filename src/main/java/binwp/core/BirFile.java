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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An in-memory representation of a lifted binary program. A program consists of
 * a list of subroutines, each of which is a list of blocks. The first block of a
 * subroutine is its entry. Every block, subroutine and block element is
 * identified by a <code>Tid</code> which is unique within the enclosing
 * program.
 */
public class BirFile {
	/**
	 * The architecture this program was lifted from.
	 */
	private final Architecture architecture;

	/**
	 * The list of top-level subroutines within this file.
	 */
	private final List<Subroutine> subroutines;

	public BirFile(Architecture architecture) {
		this(architecture, Collections.emptyList());
	}

	public BirFile(Architecture architecture, Collection<Subroutine> subroutines) {
		this.architecture = Objects.requireNonNull(architecture);
		this.subroutines = new ArrayList<>(subroutines);
	}

	public Architecture getArchitecture() {
		return architecture;
	}

	public List<Subroutine> getSubroutines() {
		return subroutines;
	}

	public void add(Subroutine subroutine) {
		subroutines.add(subroutine);
	}

	/**
	 * Find a subroutine by name, or return <code>null</code> if no such
	 * subroutine exists.
	 *
	 * @param name
	 * @return
	 */
	public Subroutine getSubroutine(String name) {
		for (Subroutine s : subroutines) {
			if (s.getName().equals(name)) {
				return s;
			}
		}
		return null;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T extends Attribute> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	/**
	 * An item which has a term identifier.
	 */
	public interface Term extends Item {
		public Tid getTid();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T extends Attribute> T getAttribute(Class<T> kind) {
			for (int i = 0; i != attributes.length; ++i) {
				Attribute ith = attributes[i];
				if (kind.isInstance(ith)) {
					return kind.cast(ith);
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}
	}

	public static abstract class AbstractTerm extends AbstractItem implements Term {
		private final Tid tid;

		public AbstractTerm(Tid tid, Attribute[] attributes) {
			super(attributes);
			this.tid = Objects.requireNonNull(tid);
		}

		@Override
		public Tid getTid() {
			return tid;
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Records the machine address from which a term was lifted.
		 */
		public static class Address implements Attribute {
			private final BigInteger address;

			public Address(BigInteger address) {
				this.address = address;
			}

			public BigInteger getAddress() {
				return address;
			}

			@Override
			public String toString() {
				return "0x" + address.toString(16);
			}
		}
	}

	// =========================================================================
	// Identifiers
	// =========================================================================

	/**
	 * A term identifier. Two identifiers are equal when their names are equal.
	 */
	public static final class Tid {
		private final String name;

		public Tid(String name) {
			this.name = Objects.requireNonNull(name);
		}

		public String getName() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Tid && ((Tid) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public enum Endian {
		LITTLE, BIG
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type {

		public static final Unknown Unknown = new Unknown();

		/**
		 * A fixed-width bit-vector.
		 */
		public static class Imm implements Type {
			private final int width;

			public Imm(int width) {
				if (width <= 0) {
					throw new IllegalArgumentException("invalid bit-vector width " + width);
				}
				this.width = width;
			}

			public int getWidth() {
				return width;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Imm && ((Imm) o).width == width;
			}

			@Override
			public int hashCode() {
				return width;
			}

			@Override
			public String toString() {
				return "u" + width;
			}
		}

		/**
		 * A memory mapping addresses of a given width to words of a given width.
		 */
		public static class Mem implements Type {
			private final int addressWidth;
			private final int wordWidth;

			public Mem(int addressWidth, int wordWidth) {
				this.addressWidth = addressWidth;
				this.wordWidth = wordWidth;
			}

			public int getAddressWidth() {
				return addressWidth;
			}

			public int getWordWidth() {
				return wordWidth;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Mem && ((Mem) o).addressWidth == addressWidth && ((Mem) o).wordWidth == wordWidth;
			}

			@Override
			public int hashCode() {
				return addressWidth * 31 + wordWidth;
			}

			@Override
			public String toString() {
				return "mem[u" + addressWidth + ", u" + wordWidth + "]";
			}
		}

		public static class Unknown implements Type {
			private Unknown() {
			}

			@Override
			public String toString() {
				return "unk";
			}
		}
	}

	/**
	 * A variable (register, flag, temporary or memory). Variables are equal when
	 * both name and type match.
	 */
	public static final class Var {
		private final String name;
		private final Type type;

		public Var(String name, Type type) {
			this.name = Objects.requireNonNull(name);
			this.type = Objects.requireNonNull(type);
		}

		public String getName() {
			return name;
		}

		public Type getType() {
			return type;
		}

		public boolean isMemory() {
			return type instanceof Type.Mem;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Var) {
				Var v = (Var) o;
				return v.name.equals(name) && v.type.equals(type);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return name.hashCode() ^ type.hashCode();
		}

		@Override
		public String toString() {
			return name + ":" + type;
		}
	}

	public enum Intent {
		IN, OUT, BOTH
	}

	// =========================================================================
	// Subroutines & Blocks
	// =========================================================================

	public static class Subroutine extends AbstractTerm {
		private final String name;
		private final List<Arg> args;
		private final List<Block> blocks;

		public Subroutine(Tid tid, String name, List<Arg> args, List<Block> blocks, Attribute... attributes) {
			super(tid, attributes);
			this.name = name;
			this.args = new ArrayList<>(args);
			this.blocks = new ArrayList<>(blocks);
		}

		public String getName() {
			return name;
		}

		public List<Arg> getArgs() {
			return args;
		}

		public List<Block> getBlocks() {
			return blocks;
		}

		/**
		 * Get the entry block, or <code>null</code> if this subroutine has no body.
		 *
		 * @return
		 */
		public Block getEntry() {
			return blocks.isEmpty() ? null : blocks.get(0);
		}

		public Block getBlock(Tid tid) {
			for (Block b : blocks) {
				if (b.getTid().equals(tid)) {
					return b;
				}
			}
			return null;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static class Arg extends AbstractItem {
		private final Var var;
		private final Intent intent;

		public Arg(Var var, Intent intent, Attribute... attributes) {
			super(attributes);
			this.var = var;
			this.intent = intent;
		}

		public Var getVar() {
			return var;
		}

		public Intent getIntent() {
			return intent;
		}

		public boolean isInput() {
			return intent != Intent.OUT;
		}

		public boolean isOutput() {
			return intent != Intent.IN;
		}
	}

	public static class Block extends AbstractTerm {
		private final List<Elt.Phi> phis;
		private final List<Elt.Def> defs;
		private final List<Elt.Jmp> jmps;

		public Block(Tid tid, List<Elt.Phi> phis, List<Elt.Def> defs, List<Elt.Jmp> jmps, Attribute... attributes) {
			super(tid, attributes);
			this.phis = new ArrayList<>(phis);
			this.defs = new ArrayList<>(defs);
			this.jmps = new ArrayList<>(jmps);
		}

		public List<Elt.Phi> getPhis() {
			return phis;
		}

		public List<Elt.Def> getDefs() {
			return defs;
		}

		public List<Elt.Jmp> getJmps() {
			return jmps;
		}
	}

	// =========================================================================
	// Block Elements
	// =========================================================================

	public interface Elt extends Term {

		public static class Phi extends AbstractTerm implements Elt {
			private final Var lhs;
			private final Map<Tid, Expr> incoming;

			public Phi(Tid tid, Var lhs, Map<Tid, Expr> incoming, Attribute... attributes) {
				super(tid, attributes);
				this.lhs = lhs;
				this.incoming = new LinkedHashMap<>(incoming);
			}

			public Var getLhs() {
				return lhs;
			}

			/**
			 * Get the incoming values, keyed by predecessor block.
			 *
			 * @return
			 */
			public Map<Tid, Expr> getIncoming() {
				return incoming;
			}
		}

		public static class Def extends AbstractTerm implements Elt {
			private final Var lhs;
			private final Expr rhs;

			public Def(Tid tid, Var lhs, Expr rhs, Attribute... attributes) {
				super(tid, attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Var getLhs() {
				return lhs;
			}

			public Expr getRhs() {
				return rhs;
			}
		}

		/**
		 * A guarded jump. The guard is a one-bit expression and the jump is taken
		 * when it evaluates to one.
		 */
		public static abstract class Jmp extends AbstractTerm implements Elt {
			private final Expr condition;

			public Jmp(Tid tid, Expr condition, Attribute[] attributes) {
				super(tid, attributes);
				this.condition = condition;
			}

			public Expr getCondition() {
				return condition;
			}

			public boolean isUnconditional() {
				return condition instanceof Expr.Constant && ((Expr.Constant) condition).getValue().signum() != 0;
			}
		}

		public static class Goto extends Jmp {
			private final Label target;

			public Goto(Tid tid, Expr condition, Label target, Attribute... attributes) {
				super(tid, condition, attributes);
				this.target = target;
			}

			public Label getTarget() {
				return target;
			}
		}

		public static class Call extends Jmp {
			private final Label target;
			private final Label returns;

			/**
			 * Construct a call. When <code>returns</code> is <code>null</code> the call
			 * does not return.
			 */
			public Call(Tid tid, Expr condition, Label target, Label returns, Attribute... attributes) {
				super(tid, condition, attributes);
				this.target = target;
				this.returns = returns;
			}

			public Label getTarget() {
				return target;
			}

			public Label getReturn() {
				return returns;
			}
		}

		public static class Ret extends Jmp {
			private final Label target;

			public Ret(Tid tid, Expr condition, Label target, Attribute... attributes) {
				super(tid, condition, attributes);
				this.target = target;
			}

			public Label getTarget() {
				return target;
			}
		}

		public static class Interrupt extends Jmp {
			private final int number;
			private final Tid returns;

			public Interrupt(Tid tid, Expr condition, int number, Tid returns, Attribute... attributes) {
				super(tid, condition, attributes);
				this.number = number;
				this.returns = returns;
			}

			public int getNumber() {
				return number;
			}

			public Tid getReturn() {
				return returns;
			}
		}
	}

	public interface Label {
		public static class Direct implements Label {
			private final Tid target;

			public Direct(Tid target) {
				this.target = target;
			}

			public Tid getTarget() {
				return target;
			}

			@Override
			public String toString() {
				return target.toString();
			}
		}

		public static class Indirect implements Label {
			private final Expr target;

			public Indirect(Expr target) {
				this.target = target;
			}

			public Expr getTarget() {
				return target;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public Type getType();

		public static class Constant extends AbstractItem implements Expr {
			private final BigInteger value;
			private final int width;

			private Constant(BigInteger value, int width, Attribute[] attributes) {
				super(attributes);
				this.width = width;
				this.value = value.mod(BigInteger.ONE.shiftLeft(width));
			}

			public BigInteger getValue() {
				return value;
			}

			public int getWidth() {
				return width;
			}

			@Override
			public Type getType() {
				return new Type.Imm(width);
			}
		}

		public static class VariableAccess extends AbstractItem implements Expr {
			private final Var var;

			private VariableAccess(Var var, Attribute[] attributes) {
				super(attributes);
				this.var = var;
			}

			public Var getVariable() {
				return var;
			}

			@Override
			public Type getType() {
				return var.getType();
			}
		}

		public static class Load extends AbstractItem implements Expr {
			private final Expr memory;
			private final Expr address;
			private final Endian endian;
			private final int size;

			private Load(Expr memory, Expr address, Endian endian, int size, Attribute[] attributes) {
				super(attributes);
				this.memory = memory;
				this.address = address;
				this.endian = endian;
				this.size = size;
			}

			public Expr getMemory() {
				return memory;
			}

			public Expr getAddress() {
				return address;
			}

			public Endian getEndian() {
				return endian;
			}

			/**
			 * The number of bits loaded.
			 *
			 * @return
			 */
			public int getSize() {
				return size;
			}

			@Override
			public Type getType() {
				return new Type.Imm(size);
			}
		}

		public static class Store extends AbstractItem implements Expr {
			private final Expr memory;
			private final Expr address;
			private final Expr value;
			private final Endian endian;
			private final int size;

			private Store(Expr memory, Expr address, Expr value, Endian endian, int size, Attribute[] attributes) {
				super(attributes);
				this.memory = memory;
				this.address = address;
				this.value = value;
				this.endian = endian;
				this.size = size;
			}

			public Expr getMemory() {
				return memory;
			}

			public Expr getAddress() {
				return address;
			}

			public Expr getValue() {
				return value;
			}

			public Endian getEndian() {
				return endian;
			}

			public int getSize() {
				return size;
			}

			@Override
			public Type getType() {
				return memory.getType();
			}
		}

		public enum BinOp {
			PLUS("+"), MINUS("-"), TIMES("*"), DIVIDE("/"), SDIVIDE("/$"), MOD("%"), SMOD("%$"), LSHIFT("<<"),
			RSHIFT(">>"), ARSHIFT("~>>"), AND("&"), OR("|"), XOR("^"), EQ("="), NEQ("<>"), LT("<"), LE("<="),
			SLT("<$"), SLE("<=$");

			private final String symbol;

			BinOp(String symbol) {
				this.symbol = symbol;
			}

			public String getSymbol() {
				return symbol;
			}

			public boolean isComparison() {
				return ordinal() >= EQ.ordinal();
			}

			public boolean isShift() {
				return this == LSHIFT || this == RSHIFT || this == ARSHIFT;
			}

			public boolean isDivision() {
				return this == DIVIDE || this == SDIVIDE || this == MOD || this == SMOD;
			}
		}

		public static class BinaryOperator extends AbstractItem implements Expr {
			private final BinOp kind;
			private final Expr lhs;
			private final Expr rhs;

			private BinaryOperator(BinOp kind, Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.kind = kind;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public BinOp getKind() {
				return kind;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public Type getType() {
				return kind.isComparison() ? new Type.Imm(1) : lhs.getType();
			}
		}

		public enum UnOp {
			NEG, NOT
		}

		public static class UnaryOperator extends AbstractItem implements Expr {
			private final UnOp kind;
			private final Expr operand;

			private UnaryOperator(UnOp kind, Expr operand, Attribute[] attributes) {
				super(attributes);
				this.kind = kind;
				this.operand = operand;
			}

			public UnOp getKind() {
				return kind;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public Type getType() {
				return operand.getType();
			}
		}

		public enum CastKind {
			UNSIGNED, SIGNED, HIGH, LOW
		}

		public static class Cast extends AbstractItem implements Expr {
			private final CastKind kind;
			private final int width;
			private final Expr operand;

			private Cast(CastKind kind, int width, Expr operand, Attribute[] attributes) {
				super(attributes);
				this.kind = kind;
				this.width = width;
				this.operand = operand;
			}

			public CastKind getKind() {
				return kind;
			}

			public int getWidth() {
				return width;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public Type getType() {
				return new Type.Imm(width);
			}
		}

		public static class Ite extends AbstractItem implements Expr {
			private final Expr condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			private Ite(Expr condition, Expr trueBranch, Expr falseBranch, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr getCondition() {
				return condition;
			}

			public Expr getTrueBranch() {
				return trueBranch;
			}

			public Expr getFalseBranch() {
				return falseBranch;
			}

			@Override
			public Type getType() {
				return trueBranch.getType();
			}
		}

		public static class Extract extends AbstractItem implements Expr {
			private final int high;
			private final int low;
			private final Expr operand;

			private Extract(int high, int low, Expr operand, Attribute[] attributes) {
				super(attributes);
				if (high < low || low < 0) {
					throw new IllegalArgumentException("invalid extraction [" + high + ":" + low + "]");
				}
				this.high = high;
				this.low = low;
				this.operand = operand;
			}

			public int getHigh() {
				return high;
			}

			public int getLow() {
				return low;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public Type getType() {
				return new Type.Imm(high - low + 1);
			}
		}

		public static class Concat extends AbstractItem implements Expr {
			private final Expr lhs;
			private final Expr rhs;

			private Concat(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public Type getType() {
				Type l = lhs.getType();
				Type r = rhs.getType();
				if (l instanceof Type.Imm && r instanceof Type.Imm) {
					return new Type.Imm(((Type.Imm) l).getWidth() + ((Type.Imm) r).getWidth());
				}
				return Type.Unknown;
			}
		}

		/**
		 * A local binding <code>let v = value in body</code>.
		 */
		public static class Let extends AbstractItem implements Expr {
			private final Var variable;
			private final Expr value;
			private final Expr body;

			private Let(Var variable, Expr value, Expr body, Attribute[] attributes) {
				super(attributes);
				this.variable = variable;
				this.value = value;
				this.body = body;
			}

			public Var getVariable() {
				return variable;
			}

			public Expr getValue() {
				return value;
			}

			public Expr getBody() {
				return body;
			}

			@Override
			public Type getType() {
				return body.getType();
			}
		}

		/**
		 * A value the lifter could not determine.
		 */
		public static class Unknown extends AbstractItem implements Expr {
			private final String description;
			private final Type type;

			private Unknown(String description, Type type, Attribute[] attributes) {
				super(attributes);
				this.description = description;
				this.type = type;
			}

			public String getDescription() {
				return description;
			}

			@Override
			public Type getType() {
				return type;
			}
		}
	}

	// =========================================================================
	// Constructors
	// =========================================================================

	public static Var REG(String name, int width) {
		return new Var(name, new Type.Imm(width));
	}

	public static Var MEMORY(String name, int addressWidth, int wordWidth) {
		return new Var(name, new Type.Mem(addressWidth, wordWidth));
	}

	public static Expr.Constant CONST(long value, int width, Attribute... attributes) {
		return new Expr.Constant(BigInteger.valueOf(value), width, attributes);
	}

	public static Expr.Constant CONST(BigInteger value, int width, Attribute... attributes) {
		return new Expr.Constant(value, width, attributes);
	}

	public static Expr.Constant TRUE(Attribute... attributes) {
		return new Expr.Constant(BigInteger.ONE, 1, attributes);
	}

	public static Expr.Constant FALSE(Attribute... attributes) {
		return new Expr.Constant(BigInteger.ZERO, 1, attributes);
	}

	public static Expr.VariableAccess VAR(Var var, Attribute... attributes) {
		return new Expr.VariableAccess(var, attributes);
	}

	public static Expr.Load LOAD(Expr memory, Expr address, Endian endian, int size, Attribute... attributes) {
		return new Expr.Load(memory, address, endian, size, attributes);
	}

	public static Expr.Store STORE(Expr memory, Expr address, Expr value, Endian endian, int size,
			Attribute... attributes) {
		return new Expr.Store(memory, address, value, endian, size, attributes);
	}

	/**
	 * Construct a binary operator. Arithmetic over two constants of the same width
	 * is folded, with the result wrapping modulo two to the width.
	 *
	 * @param kind
	 * @param lhs
	 * @param rhs
	 * @param attributes
	 * @return
	 */
	public static Expr BINOP(Expr.BinOp kind, Expr lhs, Expr rhs, Attribute... attributes) {
		if (lhs instanceof Expr.Constant && rhs instanceof Expr.Constant) {
			Expr.Constant l = (Expr.Constant) lhs;
			Expr.Constant r = (Expr.Constant) rhs;
			if (l.getWidth() == r.getWidth()) {
				switch (kind) {
				case PLUS:
					return CONST(l.getValue().add(r.getValue()), l.getWidth(), attributes);
				case MINUS:
					return CONST(l.getValue().subtract(r.getValue()), l.getWidth(), attributes);
				case TIMES:
					return CONST(l.getValue().multiply(r.getValue()), l.getWidth(), attributes);
				case AND:
					return CONST(l.getValue().and(r.getValue()), l.getWidth(), attributes);
				case OR:
					return CONST(l.getValue().or(r.getValue()), l.getWidth(), attributes);
				case XOR:
					return CONST(l.getValue().xor(r.getValue()), l.getWidth(), attributes);
				case EQ:
					return l.getValue().equals(r.getValue()) ? TRUE(attributes) : FALSE(attributes);
				case NEQ:
					return l.getValue().equals(r.getValue()) ? FALSE(attributes) : TRUE(attributes);
				default:
					break;
				}
			}
		}
		return new Expr.BinaryOperator(kind, lhs, rhs, attributes);
	}

	public static Expr ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINOP(Expr.BinOp.PLUS, lhs, rhs, attributes);
	}

	public static Expr SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINOP(Expr.BinOp.MINUS, lhs, rhs, attributes);
	}

	public static Expr MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINOP(Expr.BinOp.TIMES, lhs, rhs, attributes);
	}

	public static Expr DIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINOP(Expr.BinOp.DIVIDE, lhs, rhs, attributes);
	}

	public static Expr AND(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINOP(Expr.BinOp.AND, lhs, rhs, attributes);
	}

	public static Expr EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINOP(Expr.BinOp.EQ, lhs, rhs, attributes);
	}

	public static Expr NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINOP(Expr.BinOp.NEQ, lhs, rhs, attributes);
	}

	public static Expr LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINOP(Expr.BinOp.LT, lhs, rhs, attributes);
	}

	public static Expr SLT(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINOP(Expr.BinOp.SLT, lhs, rhs, attributes);
	}

	public static Expr.UnaryOperator NEG(Expr operand, Attribute... attributes) {
		return new Expr.UnaryOperator(Expr.UnOp.NEG, operand, attributes);
	}

	public static Expr.UnaryOperator NOT(Expr operand, Attribute... attributes) {
		return new Expr.UnaryOperator(Expr.UnOp.NOT, operand, attributes);
	}

	public static Expr.Cast CAST(Expr.CastKind kind, int width, Expr operand, Attribute... attributes) {
		return new Expr.Cast(kind, width, operand, attributes);
	}

	public static Expr.Ite ITE(Expr condition, Expr trueBranch, Expr falseBranch, Attribute... attributes) {
		return new Expr.Ite(condition, trueBranch, falseBranch, attributes);
	}

	public static Expr.Extract EXTRACT(int high, int low, Expr operand, Attribute... attributes) {
		return new Expr.Extract(high, low, operand, attributes);
	}

	public static Expr.Concat CONCAT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Concat(lhs, rhs, attributes);
	}

	public static Expr.Let LET(Var variable, Expr value, Expr body, Attribute... attributes) {
		return new Expr.Let(variable, value, body, attributes);
	}

	public static Expr.Unknown UNKNOWN(String description, Type type, Attribute... attributes) {
		return new Expr.Unknown(description, type, attributes);
	}

	public static Label.Direct DIRECT(Tid target) {
		return new Label.Direct(target);
	}

	public static Label.Indirect INDIRECT(Expr target) {
		return new Label.Indirect(target);
	}

	public static List<Arg> ARGS(Arg... args) {
		return Arrays.asList(args);
	}
}
