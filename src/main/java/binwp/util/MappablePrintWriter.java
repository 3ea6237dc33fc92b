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
package binwp.util;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * A print writer which remembers the item each piece of text was printed for.
 * This allows a position in the output, such as one reported by an external
 * tool, to be traced back to the item it came from. Indentation is printed
 * automatically at the start of each line and is never mapped.
 *
 * @param <T> the kind of item printed.
 */
public class MappablePrintWriter<T> {
	private static final String INDENT = "  ";

	private final PrintWriter out;
	private final Mapping<T> mapping = new Mapping<>();
	private int column;
	private int depth;

	public MappablePrintWriter(OutputStream os) {
		this(new PrintWriter(os));
	}

	public MappablePrintWriter(PrintWriter writer) {
		this.out = writer;
	}

	public Mapping<T> getMapping() {
		return mapping;
	}

	/**
	 * Print a string associated with a given item.
	 *
	 * @param text
	 * @param item
	 */
	public void print(String text, T item) {
		if (column == 0) {
			for (int i = 0; i != depth; ++i) {
				out.print(INDENT);
				column += INDENT.length();
			}
		}
		out.print(text);
		mapping.put(item, column, text.length());
		column += text.length();
	}

	public void println(String text, T item) {
		print(text, item);
		println();
	}

	public void println() {
		out.println();
		mapping.newLine();
		column = 0;
	}

	/**
	 * Increase the indentation of subsequent lines by one level.
	 */
	public void indent() {
		depth++;
	}

	public void outdent() {
		if (depth == 0) {
			throw new IllegalStateException("indentation already at zero");
		}
		depth--;
	}

	public void flush() {
		out.flush();
	}

	/**
	 * Maps positions in the output to the items printed there.
	 *
	 * @param <T>
	 */
	public static class Mapping<T> {
		/**
		 * For each line, the spans printed on it keyed by their first column.
		 */
		private final ArrayList<NavigableMap<Integer, Span<T>>> lines = new ArrayList<>();

		public Mapping() {
			newLine();
		}

		public void put(T item, int start, int length) {
			if (length > 0) {
				lines.get(lines.size() - 1).put(start, new Span<>(item, start, start + length - 1));
			}
		}

		public void newLine() {
			lines.add(new TreeMap<>());
		}

		/**
		 * Get the item printed at a given position, or <code>null</code> if there
		 * is none.
		 *
		 * @param line line number, starting from 1.
		 * @param col  column, starting from 0.
		 * @return
		 */
		public T get(int line, int col) {
			if (line < 1 || line > lines.size()) {
				return null;
			}
			Map.Entry<Integer, Span<T>> e = lines.get(line - 1).floorEntry(col);
			return e != null && e.getValue().contains(col) ? e.getValue().getItem() : null;
		}
	}

	/**
	 * A region of text on one line, from its start column to its end column
	 * inclusive.
	 */
	public static class Span<T> {
		private final T item;
		private final int start;
		private final int end;

		public Span(T item, int start, int end) {
			this.item = item;
			this.start = start;
			this.end = end;
		}

		public T getItem() {
			return item;
		}

		public boolean contains(int col) {
			return col >= start && col <= end;
		}
	}
}
