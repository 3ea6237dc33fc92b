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

import java.util.ArrayList;
import java.util.List;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

public class Util {

    /**
     * Construct the equality of two terms with the same sort.
     *
     * @param ctx
     * @param lhs
     * @param rhs
     * @return
     */
    @SuppressWarnings({ "rawtypes", "unchecked" })
    public static BoolExpr equal(Context ctx, Expr<?> lhs, Expr<?> rhs) {
        if (!lhs.getSort().equals(rhs.getSort())) {
            throw new TranslationException("cannot compare " + lhs.getSort() + " with " + rhs.getSort());
        }
        return ctx.mkEq((Expr) lhs, (Expr) rhs);
    }

    /**
     * Convert a one-bit vector into a boolean, where one means true.
     *
     * @param ctx
     * @param bit
     * @return
     */
    public static BoolExpr toBool(Context ctx, BitVecExpr bit) {
        if (bit.getSortSize() != 1) {
            throw new WidthMismatchException("condition", 1, bit.getSortSize());
        }
        return ctx.mkEq(bit, ctx.mkBV(1, 1));
    }

    public static BitVecExpr toBit(Context ctx, BoolExpr b) {
        return (BitVecExpr) ctx.mkITE(b, ctx.mkBV(1, 1), ctx.mkBV(0, 1));
    }

    /**
     * Functional list append. This creates a fresh list containing both
     * <code>left</code> and <code>right</code> operands.
     *
     * @param left
     * @param right
     * @param <T>
     * @return
     */
    public static <T> List<T> append(List<? extends T> left, List<? extends T> right) {
        ArrayList<T> result = new ArrayList<>();
        result.addAll(left);
        result.addAll(right);
        return result;
    }
}
