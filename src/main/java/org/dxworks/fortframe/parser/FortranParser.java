package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.diagnostics.FortranStructureException;
import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.io.IoStatementParser;
import org.dxworks.fortframe.model.CallRecord;
import org.dxworks.fortframe.model.ChildSlot;
import org.dxworks.fortframe.model.EntityKind;
import org.dxworks.fortframe.model.EntityRef;
import org.dxworks.fortframe.model.FortranBlockData;
import org.dxworks.fortframe.model.FortranBoundProcedure;
import org.dxworks.fortframe.model.FortranCodeUnit;
import org.dxworks.fortframe.model.FortranCommon;
import org.dxworks.fortframe.model.FortranContainer;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranEnum;
import org.dxworks.fortframe.model.FortranFinalProc;
import org.dxworks.fortframe.model.FortranFunction;
import org.dxworks.fortframe.model.FortranInterface;
import org.dxworks.fortframe.model.FortranModule;
import org.dxworks.fortframe.model.FortranModuleProcedure;
import org.dxworks.fortframe.model.FortranModuleProcedureReference;
import org.dxworks.fortframe.model.FortranNamelist;
import org.dxworks.fortframe.model.FortranProcedure;
import org.dxworks.fortframe.model.FortranProgram;
import org.dxworks.fortframe.model.FortranSourceFile;
import org.dxworks.fortframe.model.FortranSubmodule;
import org.dxworks.fortframe.model.FortranSubroutine;
import org.dxworks.fortframe.model.FortranType;
import org.dxworks.fortframe.model.FortranVariable;
import org.dxworks.fortframe.model.UseStatement;
import org.dxworks.fortframe.reader.FortranReader;
import org.dxworks.fortframe.reader.SourceLine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the entity tree of one source file. Every statement is matched against
 * {@link FortranPatterns} in a fixed order; the first pattern that matches decides
 * what the statement is. Nested constructs are parsed recursively until their END.
 */
public class FortranParser {

    private static final List<String> PERMISSIONS = List.of("public", "private", "protected");
    private static final List<String> PROCEDURE_PREFIXES =
            List.of("impure", "pure", "elemental", "non_recursive", "recursive", "module");
    private static final List<String> DIMENSION_ATTRIBUTES = List.of("dimension", "allocatable", "pointer");
    private static final Pattern ACCESS_SPLIT = Pattern.compile("[,\\s]+");

    private final FortframeConfig config;
    private final WarningLog warnings;

    public FortranParser(FortframeConfig config, WarningLog warnings) {
        this.config = config;
        this.warnings = warnings;
    }

    /**
     * In permissive mode a structural error ends the file: it is logged and the
     * units completed before it are returned.
     */
    public FortranSourceFile parse(String filename, String path, String text, SourceForm form) {
        FortranReader reader = new FortranReader(text, form, config);
        ParseContext ctx = new ParseContext(config, warnings, filename, reader);
        FortranSourceFile file = new FortranSourceFile(filename, path, form.getName(), config.getDisplay());
        try {
            parseBody(file, ctx);
        } catch (FortranStructureException e) {
            if (!config.isPermissive()) {
                throw e;
            }
            warnings.warn(WarningKind.STRUCTURE, filename, e.getLine(), null,
                    e.getMessage() + " (rest of file skipped)");
        }
        return file;
    }

    private static final class BodyState {
        boolean inContains;
        int blockLevel;
        String childPermission;
        final Associations associations = new Associations();

        BodyState(String childPermission) {
            this.childPermission = childPermission;
        }
    }

    void parseBody(FortranContainer entity, ParseContext ctx) {
        BodyState body = new BodyState(entity.kind() == EntityKind.TYPE ? "public" : entity.permission);
        while (ctx.source.hasNext()) {
            SourceLine next = ctx.source.next();
            if (ctx.isDocLine(next.text)) {
                entity.docList.add(next.text.substring(ctx.docPrefix.length()));
                continue;
            }
            if (!next.text.isBlank()) {
                entity.numLines++;
            }
            MaskedLine masked = QuotedStrings.mask(next.text, next.lineNumber);
            String lower = masked.text.toLowerCase();
            String line = config.isLowercase() ? lower : masked.text;
            if (dispatch(entity, body, line, lower, masked, ctx)) {
                return;
            }
        }
        if (entity.kind() != EntityKind.SOURCE_FILE) {
            throw new FortranStructureException(ctx.filename, ctx.source.currentLineNumber(),
                    "File ended while still nested" + describe(entity));
        }
    }

    /** @return true when {@code line} closed {@code entity} */
    private boolean dispatch(FortranContainer entity, BodyState body, String line, String lower,
                             MaskedLine masked, ParseContext ctx) {
        Matcher m;
        if (lower.equals("contains")) {
            if (!body.inContains && entity.kind().canHaveContains()) {
                body.inContains = true;
                if (entity.kind() == EntityKind.TYPE) {
                    body.childPermission = "public";
                }
            } else if (body.inContains) {
                error(entity, masked, "Multiple CONTAINS statements present", true, ctx);
            } else {
                error(entity, masked, "Unexpected CONTAINS statement", true, ctx);
            }
        } else if (PERMISSIONS.contains(lower)) {
            body.childPermission = lower;
            if (entity.kind() != EntityKind.TYPE) {
                entity.permission = lower;
            }
        } else if (lower.equals("sequence")) {
            if (entity instanceof FortranType) {
                ((FortranType) entity).sequence = true;
            }
        } else if (FortranPatterns.FORMAT.matcher(line).lookingAt()) {
            return false;
        } else if ((m = FortranPatterns.ATTRIB.matcher(line)).lookingAt() && body.blockLevel == 0) {
            attributeStatement(entity, m, masked, ctx);
        } else if ((m = FortranPatterns.END.matcher(line)).lookingAt()) {
            return endStatement(entity, body, m, masked, ctx);
        } else if ((m = FortranPatterns.MODPROC.matcher(line)).lookingAt()
                && (m.group("module") != null || entity.kind() == EntityKind.INTERFACE)) {
            if (entity instanceof FortranInterface) {
                ((FortranInterface) entity).modProcs.addAll(moduleProcedureReferences((FortranInterface) entity,
                        m.group("names"), masked, ctx));
            } else if (entity instanceof FortranModule) {
                FortranModuleProcedure procedure =
                        new FortranModuleProcedure(m.group("names").strip(), entity, entity.permission);
                ((FortranModule) entity).moduleProcedures.add(openContainer(procedure, entity, masked, ctx));
            } else {
                error(entity, masked, "Unexpected MODULE PROCEDURE", true, ctx);
            }
        } else if ((m = FortranPatterns.BLOCK_DATA.matcher(line)).lookingAt()) {
            if (entity instanceof FortranSourceFile) {
                FortranBlockData blockData = new FortranBlockData(m.group(1), entity);
                ((FortranSourceFile) entity).blockData.add(openContainer(blockData, entity, masked, ctx));
            } else {
                error(entity, masked, "Unexpected BLOCK DATA", true, ctx);
            }
        } else if (FortranPatterns.BLOCK.matcher(line).lookingAt()) {
            body.blockLevel++;
        } else if ((m = FortranPatterns.ASSOCIATE.matcher(line)).lookingAt()) {
            if (entity.accepts(ChildSlot.CALLS)) {
                addProcedureCalls((FortranCodeUnit) entity, line, masked.lineNumber, body.associations);
            }
            List<String> selectors = FortranTextUtils.stripParen(m.group("associations"), 0);
            body.associations.addBatch(selectors.isEmpty()
                    ? List.of()
                    : FortranTextUtils.splitTopLevel(selectors.get(0), ','));
        } else if ((m = FortranPatterns.MODULE.matcher(line)).lookingAt()) {
            if (entity instanceof FortranSourceFile) {
                FortranModule module = new FortranModule(m.group("name"), entity, "public");
                ((FortranSourceFile) entity).modules.add(openContainer(module, entity, masked, ctx));
            } else {
                error(entity, masked, "Unexpected MODULE", true, ctx);
            }
        } else if ((m = FortranPatterns.SUBMODULE.matcher(line)).lookingAt()) {
            if (entity instanceof FortranSourceFile) {
                FortranSubmodule submodule =
                        new FortranSubmodule(m.group("name"), entity, m.group("ancestor"), m.group("parent"));
                ((FortranSourceFile) entity).submodules.add(openContainer(submodule, entity, masked, ctx));
            } else {
                error(entity, masked, "Unexpected SUBMODULE", true, ctx);
            }
        } else if ((m = FortranPatterns.PROGRAM.matcher(line)).lookingAt()) {
            if (entity instanceof FortranSourceFile) {
                FortranSourceFile file = (FortranSourceFile) entity;
                if (!file.programs.isEmpty()) {
                    error(entity, masked, "Multiple PROGRAM units in same source file", false, ctx);
                }
                file.programs.add(openContainer(new FortranProgram(m.group(1), entity), entity, masked, ctx));
            } else {
                error(entity, masked, "Unexpected PROGRAM", true, ctx);
            }
        } else if ((m = FortranPatterns.SUBROUTINE.matcher(line)).lookingAt()) {
            if (entity.kind().isCodeUnit() && !body.inContains) {
                error(entity, masked, "Unexpected SUBROUTINE", true, ctx);
            } else if (entity.accepts(ChildSlot.SUBROUTINE)) {
                FortranSubroutine subroutine = new FortranSubroutine(m.group("name"), entity, entity.permission);
                initProcedure(subroutine, m.group("arguments"), m.group("attributes"), m.group("bindC"), masked);
                entity.subroutines.add(openContainer(subroutine, entity, masked, ctx));
            } else {
                error(entity, masked, "Unexpected SUBROUTINE", true, ctx);
            }
        } else if ((m = FortranPatterns.NAMELIST.matcher(line)).lookingAt()) {
            if (entity.accepts(ChildSlot.NAMELIST)) {
                entity.namelists.add(namelist(entity, m, masked, ctx));
            } else {
                error(entity, masked, "Unexpected NAMELIST", true, ctx);
            }
        } else if ((m = FortranPatterns.FUNCTION.matcher(line)).lookingAt()) {
            if (entity.kind().isCodeUnit() && !body.inContains) {
                error(entity, masked, "Unexpected FUNCTION", true, ctx);
            } else if (entity.accepts(ChildSlot.FUNCTION)) {
                entity.functions.add(openContainer(function(entity, m, masked, ctx), entity, masked, ctx));
            } else {
                error(entity, masked, "Unexpected FUNCTION", true, ctx);
            }
        } else if ((m = FortranPatterns.TYPE.matcher(line)).lookingAt() && body.blockLevel == 0) {
            if (entity.accepts(ChildSlot.TYPE)) {
                entity.types.add(openContainer(derivedType(entity, m), entity, masked, ctx));
            } else {
                error(entity, masked, "Unexpected derived TYPE", true, ctx);
            }
        } else if ((m = FortranPatterns.INTERFACE.matcher(line)).lookingAt() && body.blockLevel == 0) {
            if (entity.accepts(ChildSlot.INTERFACE)) {
                interfaceBlock(entity, m, masked, ctx);
            } else {
                error(entity, masked, "Unexpected INTERFACE", true, ctx);
            }
        } else if (FortranPatterns.ENUM.matcher(line).lookingAt() && body.blockLevel == 0) {
            if (entity.accepts(ChildSlot.ENUM)) {
                entity.enums.add(openContainer(new FortranEnum("", entity, entity.permission), entity, masked, ctx));
            } else {
                error(entity, masked, "Unexpected ENUM", true, ctx);
            }
        } else if ((m = FortranPatterns.BOUNDPROC.matcher(line)).lookingAt() && body.inContains) {
            if (entity.accepts(ChildSlot.BOUND_PROCEDURE)) {
                boundProcedures((FortranType) entity, line, m, body.childPermission, masked, ctx);
            } else {
                error(entity, masked, "Unexpected type-bound procedure", true, ctx);
            }
        } else if ((m = FortranPatterns.COMMON.matcher(line)).lookingAt()) {
            if (entity.accepts(ChildSlot.COMMON)) {
                commonBlocks(entity, line, m, masked, ctx);
            } else {
                error(entity, masked, "Unexpected COMMON statement", true, ctx);
            }
        } else if ((m = FortranPatterns.FINAL.matcher(line)).lookingAt() && body.inContains) {
            if (entity.accepts(ChildSlot.FINAL_PROCEDURE)) {
                finalProcedures((FortranType) entity, m.group(1), masked, ctx);
            } else {
                error(entity, masked, "Unexpected finalization procedure", true, ctx);
            }
        } else if (ctx.variablePattern.matcher(line).lookingAt() && body.blockLevel == 0) {
            if (entity.accepts(ChildSlot.VARIABLE)) {
                List<String> doc = ctx.readDocstring();
                try {
                    entity.variables.addAll(DeclarationParser.lineToVariables(line, masked.strings, ctx.varTypePattern,
                            body.childPermission, entity, doc, masked.lineNumber));
                } catch (IllegalArgumentException e) {
                    error(entity, masked, e.getMessage(), true, ctx);
                }
            } else {
                error(entity, masked, "Unexpected variable", true, ctx);
            }
        } else if ((m = FortranPatterns.USE.matcher(line)).lookingAt()) {
            if (entity.accepts(ChildSlot.USE)) {
                ((FortranCodeUnit) entity).uses.add(new UseStatement(m.group(1), m.group(2), masked.lineNumber));
            } else {
                error(entity, masked, "Unexpected USE statement", true, ctx);
            }
        } else if (FortranPatterns.ARITH_GOTO.matcher(line).find()) {
            return false;
        } else {
            executableStatement(entity, body, line, masked, ctx);
        }
        return false;
    }

    private boolean endStatement(FortranContainer entity, BodyState body, Matcher m, MaskedLine masked,
                                 ParseContext ctx) {
        if (entity instanceof FortranSourceFile) {
            error(entity, masked, "END statement outside of any nesting", false, ctx);
            return false;
        }
        String endType = m.group(1) == null ? "" : m.group(1).toLowerCase();
        if (endType.equals("block")) {
            body.blockLevel--;
        } else if (endType.equals("associate")) {
            try {
                body.associations.removeLastBatch();
            } catch (IllegalStateException e) {
                error(entity, masked, "END ASSOCIATE without ASSOCIATE", true, ctx);
            }
        } else if (body.blockLevel == 0) {
            EntityCleanup.cleanup(entity, ctx);
            return true;
        }
        return false;
    }

    private void executableStatement(FortranContainer entity, BodyState body, String line, MaskedLine masked,
                                     ParseContext ctx) {
        boolean callMatch = FortranPatterns.CALL.matcher(line).find();
        boolean subcallMatch = !callMatch && FortranPatterns.SUBCALL.matcher(line).find();
        boolean hasCalls = entity.accepts(ChildSlot.CALLS);
        if (hasCalls) {
            IoStatementParser.observe(masked.restore(line), masked.lineNumber, ((FortranCodeUnit) entity).ioTracker);
        }

        if (callMatch || subcallMatch) {
            if (!hasCalls) {
                // function references are easily confused with array accesses
                if (subcallMatch) {
                    error(entity, masked, "Unexpected procedure call", true, ctx);
                }
                return;
            }
            addProcedureCalls((FortranCodeUnit) entity, line, masked.lineNumber, body.associations);
        } else if (entity instanceof FortranCodeUnit) {
            memberAccess((FortranCodeUnit) entity, line);
        }
    }

    // ---- Calls and member access ----

    void addProcedureCalls(FortranCodeUnit unit, String line, Integer lineNumber, Associations associations) {
        List<String> chains = new ArrayList<>();
        int depth = 0;
        List<String> pieces = FortranTextUtils.stripParen(line, depth);

        if (!pieces.isEmpty()) {
            Matcher subcall = FortranPatterns.SUBCALL.matcher(pieces.get(0));
            if (subcall.find()) {
                chains.add(subcall.group("chain"));
                // the argument list of a CALL holds no reference at this depth
                depth++;
                pieces = FortranTextUtils.stripParen(line, depth);
            }
        }

        while (!pieces.isEmpty()) {
            for (String piece : pieces) {
                memberAccess(unit, piece);
                Matcher call = FortranPatterns.CALL.matcher(piece);
                while (call.find()) {
                    chains.add(call.group("chain"));
                }
            }
            depth++;
            pieces = FortranTextUtils.stripParen(line, depth);
        }

        for (String chainText : chains) {
            String compact = FortranPatterns.CALL_AND_WHITESPACE.matcher(chainText).replaceAll("").toLowerCase();
            List<String> chain = new ArrayList<>(Arrays.asList(compact.split("%")));
            List<String> associated = associations.get(chain.get(0));
            if (associated != null) {
                chain.remove(0);
                chain.addAll(0, associated);
            }
            String last = chain.get(chain.size() - 1);
            if (Intrinsics.isIntrinsic(last) || unit.hasCall(last)) {
                continue;
            }
            unit.calls.add(new CallRecord(chain, lineNumber));
        }
    }

    /** Sorts the tokens of {@code text} into member accesses ({@code a%b%c}) and everything else. */
    static void memberAccess(FortranCodeUnit unit, String text) {
        for (String token : ACCESS_SPLIT.split(text.strip())) {
            String cleaned = token.replace("()", "").strip();
            if (cleaned.isEmpty()) {
                continue;
            }
            for (String part : cleaned.split("=")) {
                String item = part.replace("(", "").replace(")", "");
                if (item.isEmpty()) {
                    continue;
                }
                if (FortranPatterns.MEMBER_ACCESS.matcher(item).lookingAt()) {
                    addOnce(unit.memberAccessResults, item);
                } else {
                    addOnce(unit.otherResults, item);
                }
            }
        }
    }

    private static void addOnce(List<String> list, String value) {
        if (!list.contains(value)) {
            list.add(value);
        }
    }

    // ---- Entity openers ----

    private <T extends FortranContainer> T openContainer(T child, FortranContainer parent, MaskedLine masked,
                                                          ParseContext ctx) {
        child.lineNumber = masked.lineNumber;
        child.numLines = 1;
        readDoc(child, ctx);
        parseBody(child, ctx);
        parent.numLines += child.numLines - 1;
        return child;
    }

    private void readDoc(FortranEntity entity, ParseContext ctx) {
        entity.docList.addAll(ctx.readDocstring());
        DocMetadata.read(entity, warnings, config.isWarnUndocumented());
    }

    private String initProcedure(FortranProcedure procedure, String arguments, String attributes, String bindC,
                                 MaskedLine masked) {
        String attribstr = "";
        if (attributes != null) {
            String remaining = attributes.toLowerCase();
            for (String prefix : PROCEDURE_PREFIXES) {
                if (remaining.contains(prefix)) {
                    procedure.attribs.add(prefix);
                    remaining = remaining.replace(prefix, "");
                }
            }
            attribstr = remaining.replace(" ", "");
        }
        procedure.module = procedure.attribs.contains("module");

        if (arguments != null) {
            String inner = arguments.substring(1, arguments.length() - 1).strip();
            for (String arg : FortranPatterns.LIST_SPLIT.split(inner)) {
                if (!arg.isEmpty()) {
                    procedure.argNames.add(arg);
                }
            }
        }
        if (bindC != null) {
            procedure.bindC = masked.restore(untilUnmatchedParen(bindC).strip());
        }
        return attribstr;
    }

    private static String untilUnmatchedParen(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    return text.substring(0, i);
                }
                depth--;
            }
        }
        return text;
    }

    private FortranFunction function(FortranContainer parent, Matcher m, MaskedLine masked, ParseContext ctx) {
        FortranFunction function = new FortranFunction(m.group("name"), parent, parent.permission);
        String attribstr = initProcedure(function, m.group("arguments"), m.group("attributes"), m.group("bindC"), masked);
        function.resultName = m.group("result") != null ? m.group("result") : function.name;

        if (ctx.varTypePattern.matcher(attribstr).lookingAt()) {
            try {
                ParsedType type = DeclarationParser.parseType(attribstr, masked.strings, ctx.varTypePattern);
                FortranVariable retvar = new FortranVariable(function.resultName, type.vartype, function, "public");
                retvar.typeKind = type.kind;
                retvar.strlen = type.strlen;
                retvar.proto = type.proto;
                function.retvar = retvar;
            } catch (IllegalArgumentException e) {
                warnings.warn(WarningKind.STRUCTURE, ctx.filename, masked.lineNumber, function.name,
                        "Could not read the result type of function '" + function.name + "': " + e.getMessage());
            }
        }
        return function;
    }

    private static FortranType derivedType(FortranContainer parent, Matcher m) {
        FortranType type = new FortranType(m.group(2), parent, parent.permission);
        if (m.group(1) != null) {
            for (String attrib : FortranPatterns.LIST_SPLIT.split(m.group(1).substring(1).strip())) {
                String lowerAttrib = attrib.strip().toLowerCase();
                Matcher extendsMatch = FortranPatterns.EXTENDS.matcher(attrib);
                if (extendsMatch.find()) {
                    type.extendsRef = new EntityRef<>(extendsMatch.group("base"));
                } else if (lowerAttrib.equals("public") || lowerAttrib.equals("private")) {
                    type.permission = lowerAttrib;
                } else if (!lowerAttrib.isEmpty()) {
                    type.attribs.add(lowerAttrib);
                }
            }
        }
        if (m.group(3) != null) {
            for (String parameter : FortranPatterns.LIST_SPLIT.split(FortranTextUtils.stripOuterParens(m.group(3)))) {
                if (!parameter.isEmpty()) {
                    type.parameterNames.add(parameter);
                }
            }
        }
        return type;
    }

    private void interfaceBlock(FortranContainer parent, Matcher m, MaskedLine masked, ParseContext ctx) {
        String name = m.group(2) == null ? null : m.group(2).strip();
        FortranInterface intf = new FortranInterface(name, parent, parent.permission);
        intf.generic = name != null;
        intf.abstractInterface = m.group(1) != null;
        if (intf.generic && intf.abstractInterface) {
            throw new FortranStructureException(ctx.filename, masked.lineNumber,
                    "Generic interface '" + name + "' can not be abstract");
        }
        openContainer(intf, parent, masked, ctx);
        if (intf.abstractInterface) {
            parent.absInterfaces.addAll(intf.contents);
        } else if (intf.generic) {
            parent.interfaces.add(intf);
        } else {
            parent.interfaces.addAll(intf.contents);
        }
    }

    private List<FortranModuleProcedureReference> moduleProcedureReferences(FortranInterface intf, String names,
                                                                           MaskedLine masked, ParseContext ctx) {
        List<FortranModuleProcedureReference> references = new ArrayList<>();
        for (String name : FortranPatterns.LIST_SPLIT.split(names.strip())) {
            FortranModuleProcedureReference reference = new FortranModuleProcedureReference(name, intf, intf.permission);
            reference.lineNumber = masked.lineNumber;
            references.add(reference);
        }
        readDoc(references.get(references.size() - 1), ctx);
        return references;
    }

    private void boundProcedures(FortranType type, String line, Matcher m, String permission, MaskedLine masked,
                                 ParseContext ctx) {
        String[] names = m.group("names").split(",");
        if (m.group("generic").equalsIgnoreCase("generic") || names.length == 1) {
            type.boundProcs.add(boundProcedure(type, m, permission, masked, ctx));
            return;
        }
        // one binding per name, each parsed as if declared alone
        String head = line.substring(0, m.start("names"));
        for (int i = names.length - 1; i >= 0; i--) {
            Matcher single = FortranPatterns.BOUNDPROC.matcher(head + names[i].strip());
            if (single.lookingAt()) {
                type.boundProcs.add(boundProcedure(type, single, permission, masked, ctx));
            }
        }
    }

    private FortranBoundProcedure boundProcedure(FortranType type, Matcher m, String permission, MaskedLine masked,
                                                 ParseContext ctx) {
        String[] split = FortranPatterns.POINTS_TO.split(m.group("names"), 2);
        FortranBoundProcedure boundProc = new FortranBoundProcedure(split[0].strip(), type, permission);
        boundProc.lineNumber = masked.lineNumber;
        for (String attribute : FortranTextUtils.splitTopLevel(m.group("attributes") == null ? "" : m.group("attributes"), ',')) {
            String attrib = attribute.strip().toLowerCase();
            if (attrib.isEmpty()) {
                continue;
            }
            if (attrib.equals("public") || attrib.equals("private")) {
                boundProc.permission = attrib;
            } else if (attrib.equals("deferred")) {
                boundProc.deferred = true;
            } else {
                boundProc.attribs.add(attrib);
            }
        }
        boundProc.generic = m.group("generic").equalsIgnoreCase("generic");
        if (m.group("prototype") != null) {
            String prototype = m.group("prototype");
            boundProc.protoName = prototype.substring(1, prototype.length() - 1).strip();
        }
        if (split.length > 1) {
            for (String binding : FortranPatterns.LIST_SPLIT.split(split[1].strip())) {
                boundProc.bindings.add(new EntityRef<>(binding.strip()));
            }
        } else {
            boundProc.bindings.add(new EntityRef<>(boundProc.name));
        }
        readDoc(boundProc, ctx);
        return boundProc;
    }

    private void commonBlocks(FortranContainer entity, String line, Matcher m, MaskedLine masked, ParseContext ctx) {
        List<String> split = splitKeepingSeparators(line);
        List<FortranCommon> blocks = new ArrayList<>();
        if (split.size() > 1) {
            for (int i = 0; i < split.size() / 2; i++) {
                String pseudoLine = split.get(0) + " " + split.get(2 * i + 1) + " " + split.get(2 * i + 2).strip();
                if (pseudoLine.endsWith(",")) {
                    pseudoLine = pseudoLine.substring(0, pseudoLine.length() - 1);
                }
                Matcher block = FortranPatterns.COMMON.matcher(pseudoLine);
                if (block.lookingAt()) {
                    blocks.add(commonBlock(entity, block, masked));
                }
            }
        } else {
            blocks.add(commonBlock(entity, m, masked));
        }
        if (blocks.isEmpty()) {
            return;
        }
        // all blocks of one statement share its documentation
        readDoc(blocks.get(0), ctx);
        for (FortranCommon block : blocks) {
            block.docList = blocks.get(0).docList;
            entity.common.add(block);
        }
    }

    private static FortranCommon commonBlock(FortranContainer entity, Matcher m, MaskedLine masked) {
        FortranCommon common = new FortranCommon(m.group(1), entity);
        common.lineNumber = masked.lineNumber;
        for (String member : FortranTextUtils.splitTopLevel(m.group(2), ',')) {
            if (!member.isBlank()) {
                common.memberNames.add(member.strip());
            }
        }
        common.visible = true;
        return common;
    }

    // "common /a/ x, y /b/ z" -> ["common", "/a/", "x, y", "/b/", "z"]
    private static List<String> splitKeepingSeparators(String line) {
        List<String> parts = new ArrayList<>();
        Matcher separator = FortranPatterns.COMMON_SPLIT.matcher(line);
        int last = 0;
        while (separator.find()) {
            parts.add(line.substring(last, separator.start()));
            parts.add(separator.group(1));
            last = separator.end();
        }
        parts.add(line.substring(last));
        return parts;
    }

    private FortranNamelist namelist(FortranContainer entity, Matcher m, MaskedLine masked, ParseContext ctx) {
        FortranNamelist namelist = new FortranNamelist(m.group("name"), entity, entity.permission);
        namelist.lineNumber = masked.lineNumber;
        for (String variable : m.group("vars").split(",")) {
            if (!variable.isBlank()) {
                namelist.memberNames.add(variable.strip().toLowerCase());
            }
        }
        namelist.visible = true;
        readDoc(namelist, ctx);
        return namelist;
    }

    private void finalProcedures(FortranType type, String names, MaskedLine masked, ParseContext ctx) {
        String[] procedures = FortranPatterns.LIST_SPLIT.split(names.strip());
        for (int i = 0; i < procedures.length; i++) {
            FortranFinalProc finalProc = new FortranFinalProc(procedures[i], type);
            finalProc.lineNumber = masked.lineNumber;
            if (i == procedures.length - 1) {
                readDoc(finalProc, ctx);
            }
            type.finalProcs.add(finalProc);
        }
    }

    // ---- Attribute statements ----

    private void attributeStatement(FortranContainer entity, Matcher m, MaskedLine masked, ParseContext ctx) {
        String attr = m.group(1).toLowerCase().replace(" ", "");
        if (attr.startsWith("bind")) {
            attr = attr.replace(",", ", ");
        }
        if (!entity.accepts(ChildSlot.ATTRIBUTES)) {
            if (!(attr.equals("data") && entity instanceof FortranSourceFile)) {
                error(entity, masked, "Unexpected " + attr.toUpperCase() + " statement", true, ctx);
            }
            return;
        }
        if (attr.equals("data")) {
            return;
        }

        if (DIMENSION_ATTRIBUTES.contains(attr)) {
            for (String item : FortranTextUtils.splitTopLevel(m.group(2), ',')) {
                String name = item.strip().toLowerCase();
                int open = name.indexOf('(');
                String varName = open >= 0 ? name.substring(0, open).strip() : name;
                String dimensions = open >= 0 ? name.substring(open) : "";
                entity.attrDict.computeIfAbsent(varName, k -> new ArrayList<>()).add(attr + dimensions);
            }
            return;
        }

        boolean parameter = attr.equals("parameter");
        String statement = m.group(2);
        if (parameter) {
            statement = FortranTextUtils.stripOuterParens(statement);
        }
        String restored = masked.restore(attr);
        for (String item : FortranTextUtils.splitTopLevel(statement, ',')) {
            String name = item;
            if (parameter) {
                List<String> split = FortranTextUtils.splitTopLevel(item, '=');
                name = split.get(0);
                if (split.size() > 1) {
                    entity.paramDict.put(name.strip().toLowerCase(),
                            masked.restore(item.substring(split.get(0).length() + 1)).strip());
                }
            }
            name = name.strip().toLowerCase();
            if (!name.isEmpty()) {
                entity.attrDict.computeIfAbsent(name, k -> new ArrayList<>()).add(restored);
            }
        }
    }

    // ---- Errors ----

    private void error(FortranContainer entity, MaskedLine masked, String message, boolean describeEntity,
                       ParseContext ctx) {
        String text = message + (describeEntity ? describe(entity) : "") + ":\n\t" + masked.restore();
        if (config.isForce()) {
            warnings.warn(WarningKind.STRUCTURE, ctx.filename, masked.lineNumber, entity.name, text);
            return;
        }
        throw new FortranStructureException(ctx.filename, masked.lineNumber, text);
    }

    private static String describe(FortranEntity entity) {
        return " in " + entity.kind().getName() + " '" + entity.name + "'";
    }
}
