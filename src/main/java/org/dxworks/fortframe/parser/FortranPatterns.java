package org.dxworks.fortframe.parser;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Statement patterns, tried by {@link FortranParser} in a fixed order. All of them
 * run on a trimmed statement whose string literals are masked.
 */
public final class FortranPatterns {

    private FortranPatterns() {
        // utility class
    }

    private static final int CI = Pattern.CASE_INSENSITIVE;

    // ---- Block structure ----

    public static final Pattern ATTRIB = Pattern.compile(
            "^(asynchronous|allocatable|bind\\s*\\(.*\\)|data|dimension|external|intent\\s*\\(\\s*\\w+\\s*\\)|optional|parameter|"
            + "pointer|private|protected|public|save|target|value|volatile)(?:\\s+|\\s*::\\s*)((/|\\(|\\w).*?)\\s*$", CI);

    public static final Pattern END = Pattern.compile(
            "^end\\s*(?:(module|submodule|subroutine|function|procedure|program|type|interface|enum|block\\sdata|block|associate)"
            + "(?:\\s+(\\w.*))?)?$", CI);

    public static final Pattern BLOCK = Pattern.compile("^(\\w+\\s*:)?\\s*block\\s*$", CI);
    public static final Pattern BLOCK_DATA = Pattern.compile("^block\\s*data\\s*(\\w+)?\\s*$", CI);
    public static final Pattern ASSOCIATE = Pattern.compile("^(\\w+\\s*:)?\\s*associate\\s*\\((?<associations>.+)\\)\\s*$", CI);
    public static final Pattern ENUM = Pattern.compile("^enum\\s*,\\s*bind\\s*\\(.*\\)\\s*$", CI);

    public static final Pattern MODPROC = Pattern.compile(
            "^(?<module>module\\s+)?procedure\\s*(?:::|\\s)\\s*(?<names>\\w.*)$", CI);
    public static final Pattern MODULE = Pattern.compile("^module(?:\\s+(?<name>\\w+))?$", CI);
    public static final Pattern SUBMODULE = Pattern.compile(
            "^submodule\\s*\\(\\s*(?<ancestor>\\w+)\\s*(?::\\s*(?<parent>\\w+))?\\s*\\)\\s*(?<name>\\w+)$", CI);
    public static final Pattern PROGRAM = Pattern.compile("^program(?:\\s+(\\w+))?$", CI);

    public static final Pattern SUBROUTINE = Pattern.compile(
            "^\\s*(?:(?<attributes>.+?)\\s+)?subroutine\\s+(?<name>\\w+)\\s*(?<arguments>\\([^()]*\\))?"
            + "(?:\\s*bind\\s*\\(\\s*(?<bindC>.*)\\s*\\))?$", CI);

    public static final Pattern FUNCTION = Pattern.compile(
            "^(?:(?<attributes>.+?)\\s*)?function\\s+(?<name>\\w+)\\s*(?<arguments>\\([^()]*\\))?"
            + "(?=(?:.*result\\s*\\(\\s*(?<result>\\w+)\\s*\\))?)"
            + "(?=(?:.*bind\\s*\\(\\s*(?<bindC>.*)\\s*\\))?).*$", CI);

    public static final Pattern TYPE = Pattern.compile(
            "^type(?:\\s+|\\s*(,.*)?::\\s*)((?!(?:is\\s*\\())\\w+)\\s*(\\([^()]*\\))?\\s*$", CI);
    public static final Pattern INTERFACE = Pattern.compile("^(abstract\\s+)?interface(?:\\s+(.+))?$", CI);

    public static final Pattern BOUNDPROC = Pattern.compile(
            "^(?<generic>generic|procedure)\\s*(?<prototype>\\([^()]*\\))?\\s*(?:,\\s*(?<attributes>\\w[^:]*))?"
            + "(?:\\s*::)?\\s*(?<names>\\w.*)$", CI);

    public static final Pattern COMMON = Pattern.compile("^common(?:\\s*/\\s*(\\w+)\\s*/\\s*|\\s+)(\\w+.*)", CI);
    public static final Pattern COMMON_SPLIT = Pattern.compile("\\s*(/\\s*\\w+\\s*/)\\s*", CI);
    public static final Pattern FINAL = Pattern.compile("^final\\s*::\\s*(\\w.*)", CI);
    public static final Pattern USE = Pattern.compile(
            "^use(?:\\s*(?:,\\s*(?:non_)?intrinsic\\s*)?::\\s*|\\s+)(\\w+)\\s*($|,.*)", CI);
    public static final Pattern NAMELIST = Pattern.compile("namelist\\s*/(?<name>\\w+)/\\s*(?<vars>(?:\\w+,?\\s*)+)", CI);
    public static final Pattern FORMAT = Pattern.compile("^[0-9]+\\s+format\\s+\\(.*\\)", CI);

    // ---- Executable statements ----

    public static final Pattern ARITH_GOTO = Pattern.compile("go\\s*to\\s*\\([0-9,\\s]+\\)", CI);
    public static final Pattern CALL = Pattern.compile(
            "(?<chain>(?:(?:\\s*\\w+\\s*(?:\\(\\))?\\s*%\\s*)+)?(?:\\w+\\s*\\(.*?\\)))", CI);
    public static final Pattern SUBCALL = Pattern.compile(
            "^(?:if\\s*\\(.*\\)\\s*)?call\\s+(?<chain>(?:.*%\\s*)?(?:\\w+\\s*(?:\\(\\))?))", CI);
    public static final Pattern CALL_AND_WHITESPACE = Pattern.compile("\\(\\)|\\s");
    public static final Pattern MEMBER_ACCESS = Pattern.compile("\\w+(?:\\(\\))?(?:%\\w+(?:\\(\\))?)+", CI);
    public static final Pattern NUMBER = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    // ---- Use statements ----

    public static final Pattern ONLY = Pattern.compile("^\\s*,\\s*only\\s*:\\s*(?=[^,])", CI);
    public static final Pattern RENAME = Pattern.compile("(\\w+)\\s*=>\\s*(\\w+)", CI);

    // ---- Declarations ----

    private static final String VARIABLE_STRING =
            "^(integer|real|double\\s*precision|character|complex|double\\s*complex|logical|type(?!\\s+is)|class(?!\\s+is|\\s+default)|"
            + "procedure|enumerator%s)\\s*((?:\\(|\\s\\w|[:,*]).*)$";
    private static final String VAR_TYPE_STRING =
            "^integer|real|double\\s*precision|character|complex|double\\s*complex|logical|type|class|procedure|enumerator";

    public static final Pattern VARKIND = Pattern.compile("\\((.*)\\)|\\*\\s*(\\d+|\\(.*\\))");
    public static final Pattern KIND = Pattern.compile("kind\\s*=\\s*([^,\\s]+)", CI);
    public static final Pattern KIND_SUFFIX = Pattern.compile("(?<initial>.*)_(?<kind>[a-z]\\w*)", CI);
    public static final Pattern LEN = Pattern.compile("(?:len\\s*=\\s*(\\w+|\\*|:|\\d+)|(\\d+))", CI);
    public static final Pattern ATTRIBSPLIT = Pattern.compile(",\\s*(\\w.*?)::\\s*(.*)\\s*");
    public static final Pattern ATTRIBSPLIT2 = Pattern.compile("\\s*(::)?\\s*(.*)\\s*");
    public static final Pattern EXTENDS = Pattern.compile("extends\\s*\\(\\s*(?<base>[^()\\s]+)\\s*\\)", CI);
    public static final Pattern DOUBLE_PREC = Pattern.compile("double\\s+precision", CI);
    public static final Pattern DOUBLE_CMPLX = Pattern.compile("double\\s+complex", CI);
    public static final Pattern COMMA_NO_SPACE = Pattern.compile(",(?!\\s)");
    public static final Pattern DIM = Pattern.compile("^\\w+\\s*(\\(.*\\))\\s*$");
    public static final Pattern PROTO = Pattern.compile("(\\*|\\w+)\\s*(?:\\((.*)\\))?");
    public static final Pattern POINTS_TO = Pattern.compile("\\s*=>\\s*");
    public static final Pattern LIST_SPLIT = Pattern.compile("\\s*,\\s*");
    public static final Pattern TYPE_WRAPPER = Pattern.compile("^(type|class)\\((.*?)(?:\\(.*\\))?\\)$", CI);

    public static Pattern variablePattern(List<String> extraVartypes) {
        return Pattern.compile(String.format(VARIABLE_STRING, alternatives(extraVartypes)), CI);
    }

    public static Pattern varTypePattern(List<String> extraVartypes) {
        return Pattern.compile(VAR_TYPE_STRING + alternatives(extraVartypes), CI);
    }

    private static String alternatives(List<String> extraVartypes) {
        StringBuilder sb = new StringBuilder();
        for (String vartype : extraVartypes) {
            sb.append('|').append(vartype);
        }
        return sb.toString();
    }
}
