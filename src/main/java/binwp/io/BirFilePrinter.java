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
package binwp.io;

import java.io.OutputStream;
import java.math.BigInteger;
import java.util.Map;

import binwp.core.BirFile;
import binwp.core.BirFile.Arg;
import binwp.core.BirFile.Block;
import binwp.core.BirFile.Elt;
import binwp.core.BirFile.Expr;
import binwp.core.BirFile.Label;
import binwp.core.BirFile.Subroutine;
import binwp.core.BirFile.Tid;
import binwp.util.MappablePrintWriter;

/**
 * Prints subroutines in a textual form close to that of the lifter.
 */
public class BirFilePrinter {
	private final MappablePrintWriter<BirFile.Item> out;

	public BirFilePrinter(OutputStream output) {
		this.out = new MappablePrintWriter<>(output);
	}

	public void flush() {
		out.flush();
	}

	public MappablePrintWriter.Mapping<BirFile.Item> getMapping() {
		return out.getMapping();
	}

	public void write(BirFile file) {
		for (Subroutine s : file.getSubroutines()) {
			writeSubroutine(s);
		}
		out.flush();
	}

	public void write(Subroutine sub) {
		writeSubroutine(sub);
		out.flush();
	}

	private void writeSubroutine(Subroutine s) {
		BirFile.Attribute.Address address = s.getAttribute(BirFile.Attribute.Address.class);
		if (address != null) {
			out.print(address + ": ", s);
		}
		out.print("sub " + s.getName() + "(", s);
		for (int i = 0; i != s.getArgs().size(); ++i) {
			if (i != 0) {
				out.print(", ", s);
			}
			writeArg(s.getArgs().get(i));
		}
		out.println(")", s);
		for (Block b : s.getBlocks()) {
			writeBlock(b);
		}
		out.println();
	}

	private void writeArg(Arg a) {
		String intent = a.getIntent().toString().toLowerCase();
		out.print(a.getVar().getName() + " :: " + intent + " " + a.getVar().getType(), a);
	}

	private void writeBlock(Block b) {
		out.println(b.getTid() + ":", b);
		out.indent();
		for (Elt.Phi p : b.getPhis()) {
			writePhi(p);
		}
		for (Elt.Def d : b.getDefs()) {
			out.print(d.getLhs().getName() + " := ", d);
			writeExpression(d.getRhs());
			out.println();
		}
		for (Elt.Jmp j : b.getJmps()) {
			writeJmp(j);
		}
		out.outdent();
	}

	private void writePhi(Elt.Phi p) {
		out.print(p.getLhs().getName() + " := phi(", p);
		boolean first = true;
		for (Map.Entry<Tid, Expr> e : p.getIncoming().entrySet()) {
			if (!first) {
				out.print(", ", p);
			}
			first = false;
			out.print("[", p);
			writeExpression(e.getValue());
			out.print(", %" + e.getKey() + "]", p);
		}
		out.println(")", p);
	}

	private void writeJmp(Elt.Jmp j) {
		if (!j.isUnconditional()) {
			out.print("when ", j);
			writeExpression(j.getCondition());
			out.print(" ", j);
		}
		if (j instanceof Elt.Goto) {
			out.print("goto ", j);
			writeLabel(j, ((Elt.Goto) j).getTarget());
		} else if (j instanceof Elt.Call) {
			Elt.Call c = (Elt.Call) j;
			out.print("call ", j);
			writeLabel(j, c.getTarget());
			if (c.getReturn() == null) {
				out.print(" with noreturn", j);
			} else {
				out.print(" with return ", j);
				writeLabel(j, c.getReturn());
			}
		} else if (j instanceof Elt.Ret) {
			out.print("return ", j);
			writeLabel(j, ((Elt.Ret) j).getTarget());
		} else if (j instanceof Elt.Interrupt) {
			Elt.Interrupt i = (Elt.Interrupt) j;
			out.print("interrupt 0x" + Integer.toHexString(i.getNumber()) + " return %" + i.getReturn(), j);
		} else {
			throw new IllegalArgumentException("unknown jump encountered (" + j.getClass().getName() + ")");
		}
		out.println();
	}

	private void writeLabel(Elt.Jmp j, Label l) {
		if (l instanceof Label.Direct) {
			out.print("%" + ((Label.Direct) l).getTarget(), j);
		} else {
			writeExpression(((Label.Indirect) l).getTarget());
		}
	}

	public void writeExpression(Expr e) {
		if (e instanceof Expr.Constant) {
			Expr.Constant c = (Expr.Constant) e;
			out.print(hex(c.getValue()) + ":" + c.getWidth(), e);
		} else if (e instanceof Expr.VariableAccess) {
			out.print(((Expr.VariableAccess) e).getVariable().getName(), e);
		} else if (e instanceof Expr.Load) {
			Expr.Load l = (Expr.Load) e;
			writeExpression(l.getMemory());
			out.print("[", e);
			writeExpression(l.getAddress());
			out.print(", " + endian(l.getEndian()) + "]:u" + l.getSize(), e);
		} else if (e instanceof Expr.Store) {
			Expr.Store s = (Expr.Store) e;
			writeExpression(s.getMemory());
			out.print(" with [", e);
			writeExpression(s.getAddress());
			out.print(", " + endian(s.getEndian()) + "]:u" + s.getSize() + " <- ", e);
			writeExpression(s.getValue());
		} else if (e instanceof Expr.BinaryOperator) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			writeBracketed(b.getLeftHandSide());
			out.print(" " + b.getKind().getSymbol() + " ", e);
			writeBracketed(b.getRightHandSide());
		} else if (e instanceof Expr.UnaryOperator) {
			Expr.UnaryOperator u = (Expr.UnaryOperator) e;
			out.print(u.getKind() == Expr.UnOp.NEG ? "-" : "~", e);
			writeBracketed(u.getOperand());
		} else if (e instanceof Expr.Cast) {
			Expr.Cast c = (Expr.Cast) e;
			out.print(c.getKind().toString().toLowerCase() + ":" + c.getWidth() + "[", e);
			writeExpression(c.getOperand());
			out.print("]", e);
		} else if (e instanceof Expr.Ite) {
			Expr.Ite i = (Expr.Ite) e;
			out.print("if ", e);
			writeExpression(i.getCondition());
			out.print(" then ", e);
			writeExpression(i.getTrueBranch());
			out.print(" else ", e);
			writeExpression(i.getFalseBranch());
		} else if (e instanceof Expr.Extract) {
			Expr.Extract x = (Expr.Extract) e;
			out.print("extract:" + x.getHigh() + ":" + x.getLow() + "[", e);
			writeExpression(x.getOperand());
			out.print("]", e);
		} else if (e instanceof Expr.Concat) {
			Expr.Concat c = (Expr.Concat) e;
			writeBracketed(c.getLeftHandSide());
			out.print(".", e);
			writeBracketed(c.getRightHandSide());
		} else if (e instanceof Expr.Let) {
			Expr.Let l = (Expr.Let) e;
			out.print("let " + l.getVariable().getName() + " = ", e);
			writeExpression(l.getValue());
			out.print(" in ", e);
			writeExpression(l.getBody());
		} else if (e instanceof Expr.Unknown) {
			Expr.Unknown u = (Expr.Unknown) e;
			out.print("unknown[" + u.getDescription() + "]:" + u.getType(), e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeBracketed(Expr e) {
		boolean simple = e instanceof Expr.Constant || e instanceof Expr.VariableAccess || e instanceof Expr.Load;
		if (!simple) {
			out.print("(", e);
		}
		writeExpression(e);
		if (!simple) {
			out.print(")", e);
		}
	}

	private static String endian(BirFile.Endian endian) {
		return endian == BirFile.Endian.LITTLE ? "el" : "be";
	}

	private static String hex(BigInteger value) {
		return "0x" + value.toString(16).toUpperCase();
	}
}
