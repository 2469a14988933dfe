package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranVariable;
import org.dxworks.fortframe.model.TypePrototype;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Type declarations: {@code real(kind=8), intent(in) :: a(3), b = 1.0_dp}.
 * Malformed declarations raise {@link IllegalArgumentException}.
 */
public final class DeclarationParser {

    private DeclarationParser() {
        // utility class
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    public static ParsedType parseType(String text, List<String> strings, Pattern varTypePattern) {
        Matcher match = varTypePattern.matcher(text);
        if (!match.lookingAt()) {
            throw new IllegalArgumentException("Invalid variable declaration: " + text);
        }

        String vartype = match.group().toLowerCase();
        if (FortranPatterns.DOUBLE_PREC.matcher(vartype).lookingAt()) {
            vartype = "double precision";
        }
        if (FortranPatterns.DOUBLE_CMPLX.matcher(vartype).lookingAt()) {
            vartype = "double complex";
        }
        String rest = text.substring(match.end()).strip();
        String kindstr = FortranTextUtils.getParens(rest);
        rest = rest.substring(kindstr.length()).strip();

        boolean derived = vartype.equals("type") || vartype.equals("class");
        if (kindstr.length() < 3 && !derived && !vartype.equals("character") && !kindstr.startsWith("*")) {
            return new ParsedType(vartype, rest);
        }

        Matcher kindMatch = FortranPatterns.VARKIND.matcher(kindstr);
        if (!kindMatch.find()) {
            if (vartype.equals("character")) {
                ParsedType parsed = new ParsedType(vartype, rest);
                parsed.strlen = "1";
                return parsed;
            }
            throw new IllegalArgumentException("Bad declaration of variable type '" + vartype + "': " + text);
        }

        boolean star;
        String args;
        if (kindMatch.group(1) != null) {
            star = false;
            args = kindMatch.group(1).strip();
        } else {
            star = true;
            args = kindMatch.group(2).strip();
            if (args.startsWith("(")) {
                args = args.substring(1, args.length() - 1).strip();
            }
        }
        args = WHITESPACE.matcher(args).replaceAll("");

        ParsedType parsed = new ParsedType(vartype, rest);
        if (derived || vartype.equals("procedure")) {
            Matcher proto = FortranPatterns.PROTO.matcher(args);
            if (!proto.lookingAt()) {
                throw new IllegalArgumentException("Bad type, class, or procedure prototype specification: " + args);
            }
            parsed.proto = new TypePrototype(proto.group(1), proto.group(2));
            return parsed;
        }

        if (vartype.equals("character")) {
            if (star) {
                parsed.strlen = args;
                return parsed;
            }
            String[] parameters = args.split(",");
            if (parameters.length > 2) {
                throw new IllegalArgumentException("Bad declaration of `character`, too many parameters: '" + text + "'");
            }
            // named parameters in any order, positional ones are len then kind
            String length = null;
            String kind = null;
            for (String parameter : parameters) {
                Matcher len = FortranPatterns.LEN.matcher(parameter);
                if (length == null && len.lookingAt()) {
                    length = len.group(1) != null ? len.group(1) : len.group(2);
                    continue;
                }
                Matcher kindParameter = FortranPatterns.KIND.matcher(parameter);
                if (kind == null && kindParameter.lookingAt()) {
                    kind = QuotedStrings.restore(kindParameter.group(1), strings);
                    continue;
                }
                if (length == null) {
                    length = parameter;
                } else if (kind == null) {
                    kind = parameter;
                }
            }
            parsed.kind = kind;
            parsed.strlen = length == null ? "1" : length;
            return parsed;
        }

        Matcher kind = FortranPatterns.KIND.matcher(args);
        parsed.kind = kind.lookingAt() ? kind.group(1) : args;
        return parsed;
    }

    /**
     * One variable per name declared on {@code text}. All of them share
     * {@code doc}, the documentation lines that followed the declaration.
     */
    public static List<FortranVariable> lineToVariables(String text, List<String> strings, Pattern varTypePattern,
                                                        String inheritedPermission, FortranEntity parent,
                                                        List<String> doc, Integer lineNumber) {
        ParsedType parsed = parseType(text, strings, varTypePattern);
        List<String> attribs = new ArrayList<>();
        String intent = "";
        boolean optional = false;
        String permission = inheritedPermission;
        boolean parameter = false;

        String declarations;
        Matcher attribMatch = FortranPatterns.ATTRIBSPLIT.matcher(parsed.rest);
        if (attribMatch.lookingAt()) {
            declarations = attribMatch.group(2).strip();
            for (String attrib : FortranTextUtils.splitTopLevel(attribMatch.group(1).strip(), ',')) {
                String trimmed = attrib.strip();
                String normalized = trimmed.toLowerCase().replace(" ", "");
                switch (normalized) {
                    case "public":
                    case "private":
                    case "protected":
                        permission = normalized;
                        break;
                    case "optional":
                        optional = true;
                        break;
                    case "parameter":
                        parameter = true;
                        break;
                    case "intent(in)":
                        intent = "in";
                        break;
                    case "intent(out)":
                        intent = "out";
                        break;
                    case "intent(inout)":
                        intent = "inout";
                        break;
                    default:
                        attribs.add(trimmed);
                }
            }
        } else {
            Matcher plain = FortranPatterns.ATTRIBSPLIT2.matcher(parsed.rest);
            declarations = plain.lookingAt() ? plain.group(2) : parsed.rest;
        }

        List<FortranVariable> variables = new ArrayList<>();
        for (String declaration : FortranTextUtils.splitTopLevel(declarations, ',')) {
            String compact = declaration.replace(" ", "");
            if (compact.isEmpty()) {
                continue;
            }
            List<String> split = FortranTextUtils.splitTopLevel(compact, '=');
            String name;
            String initial = null;
            boolean points = false;
            if (split.size() > 1) {
                name = split.get(0);
                String value = compact.substring(name.length() + 1);
                points = value.startsWith(">");
                initial = points ? value.substring(1) : value;
            } else {
                name = compact;
            }
            if (initial != null && !initial.isEmpty()) {
                initial = QuotedStrings.restore(FortranPatterns.COMMA_NO_SPACE.matcher(initial).replaceAll(", "), strings);
            }

            FortranVariable variable = new FortranVariable(name, parsed.vartype, parent, permission);
            variable.attribs = new ArrayList<>(attribs);
            variable.intent = intent;
            variable.optional = optional;
            variable.parameter = parameter;
            variable.typeKind = parsed.kind;
            variable.strlen = parsed.strlen;
            variable.proto = parsed.proto == null ? null : parsed.proto.copy();
            variable.docList = new ArrayList<>(doc);
            variable.points = points;
            variable.initial = initial;
            variable.lineNumber = lineNumber;
            variables.add(variable);
        }
        return variables;
    }

    /** {@code 1.0_dp} becomes {@code 1.0}; literals without a kind suffix are returned unchanged. */
    public static String removeKindSuffix(String literal) {
        Matcher m = FortranPatterns.KIND_SUFFIX.matcher(literal);
        return m.lookingAt() ? m.group("initial") : literal;
    }
}
