package org.dxworks.fortframe.parser;

import java.util.Set;

/**
 * Names that look like procedure calls but are intrinsic procedures or
 * statement keywords followed by a parenthesis.
 */
public final class Intrinsics {

    private Intrinsics() {
        // utility class
    }

    public static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "if", "while", "select", "case", "where", "elsewhere", "forall", "do", "go", "goto",
            "read", "write", "print", "open", "close", "inquire", "rewind", "backspace", "endfile", "flush",
            "wait", "format", "allocate", "deallocate", "nullify", "return", "stop", "error", "call", "then",
            "else", "elseif", "type", "class", "rank", "change", "sync", "lock", "unlock", "critical", "concurrent",
            "result", "bind", "intent", "dimension", "kind", "len", "character", "integer", "real", "complex",
            "logical", "double", "precision", "procedure", "data", "common", "equivalence", "entry", "pause",
            "assign", "to", "in", "out", "inout");

    public static final Set<String> PROCEDURES = Set.of(
            "abs", "achar", "acos", "acosh", "adjustl", "adjustr", "aimag", "aint", "all", "allocated", "anint",
            "any", "asin", "asinh", "associated", "atan", "atan2", "atanh", "atomic_define", "atomic_ref",
            "bessel_j0", "bessel_j1", "bessel_jn", "bessel_y0", "bessel_y1", "bessel_yn", "bge", "bgt", "bit_size",
            "ble", "blt", "btest", "c_associated", "c_f_pointer", "c_f_procpointer", "c_funloc", "c_loc",
            "c_sizeof", "ceiling", "char", "cmplx", "co_broadcast", "co_max", "co_min", "co_reduce", "co_sum",
            "command_argument_count", "conjg", "cos", "cosh", "count", "cpu_time", "cshift", "dabs", "dble",
            "dcos", "dexp", "dlog", "dmax1", "dmin1", "dsqrt", "dsin", "date_and_time", "digits", "dim",
            "dot_product", "dprod", "dshiftl", "dshiftr", "eoshift", "epsilon", "erf", "erfc", "erfc_scaled",
            "execute_command_line", "exp", "exponent", "extends_type_of", "findloc", "float", "floor", "fraction",
            "gamma", "get_command", "get_command_argument", "get_environment_variable", "huge", "hypot", "iachar",
            "iall", "iand", "iany", "ibclr", "ibits", "ibset", "ichar", "idint", "idnint", "ieor", "ifix",
            "image_index", "index", "int", "ior", "iparity", "is_contiguous", "is_iostat_end", "is_iostat_eor",
            "ishft", "ishftc", "kind", "lbound", "lcobound", "leadz", "len", "len_trim", "lge", "lgt", "lle",
            "llt", "log", "log10", "log_gamma", "logical", "maskl", "maskr", "matmul", "max", "max0", "max1",
            "maxexponent", "maxloc", "maxval", "merge", "merge_bits", "min", "min0", "min1", "minexponent",
            "minloc", "minval", "mod", "modulo", "move_alloc", "mvbits", "nearest", "new_line", "nint", "norm2",
            "not", "null", "num_images", "pack", "parity", "popcnt", "poppar", "precision", "present", "product",
            "radix", "random_number", "random_seed", "range", "real", "repeat", "reshape", "rrspacing",
            "same_type_as", "scale", "scan", "selected_char_kind", "selected_int_kind", "selected_real_kind",
            "set_exponent", "shape", "shifta", "shiftl", "shiftr", "sign", "sin", "sinh", "size", "sngl",
            "spacing", "spread", "sqrt", "storage_size", "sum", "system_clock", "tan", "tanh", "this_image",
            "tiny", "trailz", "transfer", "transpose", "trim", "ubound", "ucobound", "unpack", "verify");

    public static boolean isIntrinsic(String name) {
        String lower = name.toLowerCase();
        return STATEMENT_KEYWORDS.contains(lower) || PROCEDURES.contains(lower);
    }
}
