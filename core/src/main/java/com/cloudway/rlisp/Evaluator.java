/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;

import com.cloudway.rlisp.LispVal.Macro.Kind;
import static com.cloudway.rlisp.LispError.*;
import static com.cloudway.rlisp.LispVal.*;

// @formatter:off

/**
 * A tree-walking evaluator over parsed terms. One evaluator owns a global
 * environment, a struct registry and the I/O ports, and forms an interpreter
 * session. Sessions are single threaded.
 *
 * <p>Calls in tail position (the last form of a body, the chosen branch of
 * {@code if} and {@code cond}, the body of {@code let}, and macro expansions)
 * are evaluated by the same loop iteration instead of a nested Java call, so
 * accumulator style recursion runs in constant Java stack.</p>
 */
public class Evaluator {
    private static final Logger logger = Logger.getLogger(Evaluator.class.getName());

    private static final Symbol ELSE = new Symbol("else");
    private static final Symbol UNQUOTE = new Symbol("unquote");
    private static final Symbol UNQUOTE_SPLICING = new Symbol("unquote-splicing");
    private static final Symbol QUASIQUOTE = new Symbol("quasiquote");

    private static final String PRELUDE = "prelude";

    private final LispParser parser = new LispParser();
    private final Config config;
    private final StructRegistry structs;
    private final MacroExpander macros;
    private final Env globalEnv;
    private final Set<Path> imported = new HashSet<>();

    private OutputPort out;
    private InputPort in;

    public Evaluator() {
        this(Config.getDefault());
    }

    public Evaluator(Config config) {
        this(config, IOPrimitives.stdout(), IOPrimitives.stdin());
    }

    public Evaluator(Config config, OutputPort out, InputPort in) {
        this.config = config;
        this.out = out;
        this.in = in;
        this.structs = new StructRegistry(config.getInt(Config.STRUCT_CAPACITY, Config.DEFAULT_STRUCT_CAPACITY));
        this.macros = new MacroExpander(this);

        globalEnv = new Env();
        globalEnv.put("nil", Nil);
        globalEnv.put("empty", Nil);
        globalEnv.put("pi", Num.make(Math.PI));
        loadPrimitives(globalEnv, Primitives.class);
        loadPrimitives(globalEnv, NumberPrimitives.class);
        loadPrimitives(globalEnv, IOPrimitives.class);

        if (config.getBoolean(Config.PRELUDE, true)) {
            loadLib(globalEnv, PRELUDE);
        }
    }

    public Env getGlobalEnv() {
        return globalEnv;
    }

    public Config getConfig() {
        return config;
    }

    public StructRegistry getStructRegistry() {
        return structs;
    }

    public LispParser getParser() {
        return parser;
    }

    public OutputPort getOutputPort() {
        return out;
    }

    public void setOutputPort(OutputPort out) {
        this.out = out;
    }

    public InputPort getInputPort() {
        return in;
    }

    public void setInputPort(InputPort in) {
        this.in = in;
    }

    // =======================================================================

    /**
     * Parses and evaluates every form of the input in the global environment.
     *
     * @return the value of the last form, or nil if there is none
     */
    public LispVal evaluate(String input) {
        return run(globalEnv, parser.read("", input));
    }

    /**
     * Evaluates a sequence of top-level forms in order.
     */
    public LispVal run(Env env, Iterator<LispVal> forms) {
        LispVal result = Nil;
        while (forms.hasNext()) {
            result = eval(forms.next(), env);
        }
        return result;
    }

    /**
     * Loads a library shipped as the classpath resource
     * {@code /META-INF/rlisp/<name>.rl}.
     */
    public void loadLib(Env env, String name) {
        String resource = "/META-INF/rlisp/" + name + ".rl";
        try (InputStream is = Evaluator.class.getResourceAsStream(resource)) {
            if (is == null)
                throw new LispError(ErrorCode.READ_FILE_FAILED, resource);

            Reader input = new InputStreamReader(is, StandardCharsets.UTF_8);
            run(env, parser.read(name, CharStreams.toString(input)));
            logger.fine(() -> "loaded library " + name);
        } catch (IOException ex) {
            throw new LispError(ErrorCode.READ_FILE_FAILED, resource, ex);
        }
    }

    /**
     * Reads, parses and evaluates a source file. A file is evaluated at
     * most once per session; later requests return nil immediately.
     */
    public LispVal load(Env env, String filename) {
        Path path = Paths.get(filename).toAbsolutePath().normalize();
        if (!imported.add(path)) {
            logger.fine(() -> "already imported " + path);
            return Nil;
        }

        String text;
        try {
            text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            imported.remove(path);
            throw new LispError(ErrorCode.READ_FILE_FAILED, filename, ex);
        }

        logger.fine(() -> "importing " + path);
        return run(env, parser.read(filename, text));
    }

    // =======================================================================

    /**
     * Reduces a term to a value.
     */
    public LispVal eval(LispVal term, Env env) {
        Env current = env;
        try {
            for (;;) {
                if (term instanceof Symbol)
                    return lookup(current, (Symbol)term);

                if (!term.isPair()) {
                    if (term.isNil())
                        throw new LispError(ErrorCode.NO_FUNCTION);
                    return term;
                }

                Pair form = (Pair)term;
                if (form.head instanceof Symbol) {
                    switch (((Symbol)form.head).name) {
                    case "quote":
                        return single(form);

                    case "quasiquote":
                        return quasiquote(current, single(form), 1);

                    case "unquote":
                    case "unquote-splicing":
                        throw new BadSyntax(ErrorCode.PARSE_FAILED, form);

                    case "define":
                        return define(current, form);

                    case "lambda":
                    case "λ":
                        return lambda(current, form);

                    case "define-macro":
                        macros.define(current, form, Kind.TEMPLATE);
                        return Nil;

                    case "define-macro-rule":
                        macros.define(current, form, Kind.RULE);
                        return Nil;

                    case "define-struct":
                        structs.define(current, form);
                        return Nil;

                    case "set!":
                        return set(current, form);

                    case "try":
                        return tryCatch(current, form);

                    case "import":
                        return load(current, unpackString(eval(single(form), current)));

                    case "begin":
                        term = sequence(current, form.tail);
                        if (term == null)
                            return Nil;
                        continue;

                    case "if":
                        term = ifBranch(current, form);
                        continue;

                    case "cond":
                        term = condBranch(current, form);
                        if (term == null)
                            return Nil;
                        continue;

                    case "let": {
                        Env ext = current.extend();
                        term = letBody(ext, form);
                        current = ext;
                        continue;
                    }

                    default:
                        break;
                    }
                }

                LispVal fn = form.head instanceof Symbol
                    ? lookupOperator(current, (Symbol)form.head, form.tail)
                    : eval(form.head, current);

                if (fn instanceof Macro) {
                    term = macros.expand((Macro)fn, form.tail);
                    continue;
                }

                LispVal args = evalArgs(current, form.tail);

                if (fn instanceof Func) {
                    Func f = (Func)fn;
                    current = bind(f, args);
                    term = sequence(current, f.body);
                    continue;
                }

                if (fn instanceof Prim)
                    return applyPrim(current, (Prim)fn, args);

                throw new NotFunction(fn);
            }
        } catch (LispError ex) {
            if (ex.getCallTrace().isEmpty())
                ex.setCallTrace(current.getCallTrace());
            throw ex;
        }
    }

    /**
     * Applies a procedure to already evaluated arguments.
     */
    public LispVal apply(Env env, LispVal fn, LispVal args) {
        if (fn instanceof Func) {
            Func f = (Func)fn;
            Env ext = bind(f, args);
            LispVal last = sequence(ext, f.body);
            return last == null ? Nil : eval(last, ext);
        }
        if (fn instanceof Prim) {
            return applyPrim(env, (Prim)fn, args);
        }
        throw new NotFunction(fn);
    }

    private static LispVal lookup(Env env, Symbol id) {
        LispVal val = env.find(id);
        if (val != null)
            return val;
        throw new UnboundVar(id.name);
    }

    // An unbound head of the form <struct>-<field> applied to an instance
    // of that struct reports the missing field instead of the identifier.
    private LispVal lookupOperator(Env env, Symbol id, LispVal argTerms) {
        LispVal val = env.find(id);
        if (val != null)
            return val;

        if (structs.hasAccessorPrefix(id.name) && Pair.length(argTerms) == 1) {
            LispVal arg = eval(((Pair)argTerms).head, env);
            if (structs.isMissingField(id.name, arg))
                throw new LispError(ErrorCode.NO_SUCH_FIELD, id.name);
        }
        throw new UnboundVar(id.name);
    }

    private LispVal evalArgs(Env env, LispVal terms) {
        List<LispVal> vals = new ArrayList<>();
        for (LispVal t = terms; t.isPair(); t = ((Pair)t).tail) {
            vals.add(eval(((Pair)t).head, env));
        }
        return Pair.fromList(vals);
    }

    private static Env bind(Func f, LispVal args) {
        int nargs = Pair.length(args);
        if (nargs != f.params.size())
            throw new NumArgs(f.params.size(), nargs);

        Env ext = f.closure.extend(f);
        for (Symbol param : f.params) {
            Pair p = (Pair)args;
            ext.put(param, p.head);
            args = p.tail;
        }
        return ext;
    }

    private static LispVal applyPrim(Env env, Prim prim, LispVal args) {
        try {
            return prim.proc.apply(env, args);
        } catch (LispError ex) {
            if (ex.getCallTrace().isEmpty())
                ex.setCallTrace(env.extend(prim).getCallTrace());
            throw ex;
        }
    }

    // Evaluates every form but the last and returns the last one
    // unevaluated, or null for an empty body.
    private LispVal sequence(Env env, LispVal body) {
        if (!body.isPair())
            return null;
        while (((Pair)body).tail.isPair()) {
            eval(((Pair)body).head, env);
            body = ((Pair)body).tail;
        }
        return ((Pair)body).head;
    }

    private static LispVal single(Pair form) {
        int n = Pair.length(form.tail);
        if (n != 1)
            throw new NumArgs(1, n);
        return ((Pair)form.tail).head;
    }

    private static String unpackString(LispVal val) {
        if (val instanceof Text)
            return ((Text)val).value;
        throw new TypeMismatch("string", val);
    }

    // -----------------------------------------------------------------------
    // Special forms

    private LispVal define(Env env, Pair form) {
        ImmutableList<LispVal> args = form.tail.isList() ? Pair.toList(form.tail) : ImmutableList.of();
        if (args.isEmpty())
            throw new BadSyntax(ErrorCode.DEFINE_SHAPE, form);

        LispVal target = args.get(0);

        if (target instanceof Symbol) {
            // (define name value)
            if (args.size() != 2)
                throw new BadSyntax(ErrorCode.DEFINE_SHAPE, form);

            Symbol name = (Symbol)target;
            if (Env.isReserved(name))
                throw new LispError(ErrorCode.RESERVED_IDENTIFIER, name.name);

            LispVal value = eval(args.get(1), env);
            if (value instanceof Func && ((Func)value).name.isEmpty())
                ((Func)value).name = name.name;
            env.define(name, value);
            return Nil;
        }

        if (target.isPair() && target.isList()) {
            // (define (name params ...) body ...)
            Pair signature = (Pair)target;
            if (!(signature.head instanceof Symbol))
                throw new BadSyntax(ErrorCode.VALUE_NOT_BOUND_TO_SYMBOL, form);

            Symbol name = (Symbol)signature.head;
            if (Env.isReserved(name))
                throw new LispError(ErrorCode.RESERVED_IDENTIFIER, name.name);
            if (args.size() < 2)
                throw new BadSyntax(ErrorCode.DEFINE_SHAPE, form);

            Func f = new Func(params(signature.tail), ((Pair)form.tail).tail, env);
            f.name = name.name;
            env.define(name, f);
            return Nil;
        }

        if (target.isPair() || target.isNil())
            throw new BadSyntax(ErrorCode.DEFINE_SHAPE, form);
        throw new BadSyntax(ErrorCode.VALUE_NOT_BOUND_TO_SYMBOL, form);
    }

    private static LispVal lambda(Env env, Pair form) {
        LispVal rest = form.tail;
        if (!rest.isPair() || !rest.isList())
            throw new BadSyntax(ErrorCode.LAMBDA_SYNTAX, form);

        LispVal params = ((Pair)rest).head;
        LispVal body = ((Pair)rest).tail;
        if (!params.isList() || body.isNil())
            throw new BadSyntax(ErrorCode.LAMBDA_SYNTAX, form);

        return new Func(params(params), body, env);
    }

    private static ImmutableList<Symbol> params(LispVal list) {
        ImmutableList.Builder<Symbol> res = ImmutableList.builder();
        for (LispVal p : Pair.toList(list)) {
            if (!(p instanceof Symbol))
                throw new BadSyntax(ErrorCode.PARAMETER_NOT_SYMBOL, p);
            if (Env.isReserved((Symbol)p))
                throw new LispError(ErrorCode.RESERVED_IDENTIFIER, ((Symbol)p).name);
            res.add((Symbol)p);
        }
        return res.build();
    }

    private LispVal set(Env env, Pair form) {
        int n = Pair.length(form.tail);
        if (n != 2 || !form.tail.isList())
            throw new NumArgs(2, n);

        LispVal target = ((Pair)form.tail).head;
        if (!(target instanceof Symbol))
            throw new TypeMismatch("symbol", target);

        LispVal value = eval(((Pair)((Pair)form.tail).tail).head, env);
        env.set((Symbol)target, value);
        return Nil;
    }

    private LispVal tryCatch(Env env, Pair form) {
        int n = Pair.length(form.tail);
        if (n != 2 || !form.tail.isList())
            throw new NumArgs(2, n);

        LispVal body = ((Pair)form.tail).head;
        LispVal handler = eval(((Pair)((Pair)form.tail).tail).head, env);
        if (!handler.isCallable())
            throw new NotFunction(handler);

        try {
            return eval(body, env);
        } catch (LispError ex) {
            logger.fine(() -> "try handler invoked for " + ex.getMessage());
            return apply(env, handler, Pair.list(ex.toErrorValue()));
        }
    }

    private LispVal ifBranch(Env env, Pair form) {
        int n = Pair.length(form.tail);
        if (n != 3 || !form.tail.isList())
            throw new NumArgs(3, n);

        Pair args = (Pair)form.tail;
        LispVal cond = eval(args.head, env);
        if (!(cond instanceof Bool))
            throw new TypeMismatch("bool", cond);

        Pair branches = (Pair)args.tail;
        return ((Bool)cond).value ? branches.head : ((Pair)branches.tail).head;
    }

    // Returns the consequent of the first clause that applies, or null when
    // no clause does.
    private LispVal condBranch(Env env, Pair form) {
        for (LispVal t = form.tail; t.isPair(); t = ((Pair)t).tail) {
            LispVal clause = ((Pair)t).head;
            if (!clause.isList())
                throw new BadSyntax(ErrorCode.COND_CASE_NOT_LIST, clause);
            if (Pair.length(clause) != 2)
                throw new BadSyntax(ErrorCode.COND_CASE_LENGTH, clause);

            Pair c = (Pair)clause;
            LispVal consequent = ((Pair)c.tail).head;
            if (ELSE.equals(c.head))
                return consequent;

            LispVal test = eval(c.head, env);
            if (!(test instanceof Bool))
                throw new BadSyntax(ErrorCode.COND_NOT_BOOLEAN, c.head);
            if (((Bool)test).value)
                return consequent;
        }
        return null;
    }

    // Binds sequentially in the new frame, so later bindings see earlier
    // ones. Returns the body term to evaluate in that frame.
    private LispVal letBody(Env ext, Pair form) {
        if (!form.tail.isPair() || !form.tail.isList())
            throw new BadSyntax(ErrorCode.BINDING_LIST, form);

        LispVal bindings = ((Pair)form.tail).head;
        LispVal body = ((Pair)form.tail).tail;

        if (!bindings.isList())
            throw new BadSyntax(ErrorCode.BINDING_LIST, bindings);

        ImmutableList<LispVal> list = Pair.toList(bindings);
        for (LispVal b : list) {
            if (!b.isList() || Pair.length(b) != 2)
                throw new BadSyntax(ErrorCode.BINDING_SHAPE, b);
            if (!(((Pair)b).head instanceof Symbol))
                throw new BadSyntax(ErrorCode.BINDING_IDENTIFIER, b);
        }
        if (body.isNil())
            throw new BadSyntax(ErrorCode.LET_BODY_MISSING, form);

        for (LispVal b : list) {
            Pair p = (Pair)b;
            ext.define((Symbol)p.head, eval(((Pair)p.tail).head, ext));
        }
        return sequence(ext, body);
    }

    private LispVal quasiquote(Env env, LispVal x, int depth) {
        if (!x.isPair())
            return x;

        Pair p = (Pair)x;
        if (UNQUOTE.equals(p.head) && isSingleton(p.tail)) {
            LispVal arg = ((Pair)p.tail).head;
            return depth == 1
                ? eval(arg, env)
                : Pair.list(UNQUOTE, quasiquote(env, arg, depth - 1));
        }
        if (QUASIQUOTE.equals(p.head) && isSingleton(p.tail)) {
            return Pair.list(QUASIQUOTE, quasiquote(env, ((Pair)p.tail).head, depth + 1));
        }

        List<LispVal> elems = new ArrayList<>();
        LispVal t = x;
        while (t.isPair()) {
            Pair cell = (Pair)t;
            if (UNQUOTE.equals(cell.head) && isSingleton(cell.tail)) {
                // dotted tail: (a . ,b)
                break;
            }

            LispVal e = cell.head;
            if (depth == 1 && e.isPair() && UNQUOTE_SPLICING.equals(((Pair)e).head)
                    && isSingleton(((Pair)e).tail)) {
                LispVal spliced = eval(((Pair)((Pair)e).tail).head, env);
                elems.addAll(Pair.toList(spliced));
            } else {
                elems.add(quasiquote(env, e, depth));
            }
            t = cell.tail;
        }
        return Pair.fromList(elems, quasiquote(env, t, depth));
    }

    private static boolean isSingleton(LispVal x) {
        return x.isPair() && ((Pair)x).tail.isNil();
    }

    // =======================================================================
    // Primitive loading

    /**
     * Binds every public static method of a primitive library in the given
     * environment. A method is bound under the names of its {@link Name}
     * annotation, or its own name with underscores turned into dashes.
     */
    public void loadPrimitives(Env env, Class<?> primLib) {
        int count = 0;
        for (Method method : primLib.getMethods()) {
            if (Modifier.isStatic(method.getModifiers())) {
                for (String name : getPrimNames(method)) {
                    env.put(name, new Prim(name, makePrimDispatcher(method)));
                    count++;
                }
            }
        }
        logger.fine("loaded " + count + " primitives from " + primLib.getSimpleName());
    }

    private static String[] getPrimNames(Method method) {
        Name nameTag = method.getAnnotation(Name.class);
        return nameTag != null ? nameTag.value() : new String[] { method.getName().replace('_', '-') };
    }

    private Prim.Proc makePrimDispatcher(Method method) {
        Class<?>[] params = method.getParameterTypes();
        Type[] generic = method.getGenericParameterTypes();
        int nparams = params.length;
        int i = 0;

        boolean passMe = i < nparams && params[i] == Evaluator.class;
        if (passMe) i++;
        boolean passEnv = i < nparams && params[i] == Env.class;
        if (passEnv) i++;

        boolean rest = method.isAnnotationPresent(VarArgs.class);
        boolean varargs = method.isVarArgs();
        int last = (rest || varargs) ? nparams - 1 : nparams;

        if (rest && (nparams == 0 || params[nparams - 1] != LispVal.class))
            throw new IllegalArgumentException("The last argument of a VarArgs method must be a LispVal: " + method);

        List<Unpacker> required = new ArrayList<>();
        List<Class<?>> requiredTypes = new ArrayList<>();
        List<Unpacker> optional = new ArrayList<>();
        List<Class<?>> optionalTypes = new ArrayList<>();

        for (; i < last; i++) {
            Class<?> opt = getOptionalType(generic[i]);
            if (opt != null) {
                optional.add(Unpacker.get(opt));
                optionalTypes.add(opt);
            } else {
                if (!optional.isEmpty())
                    throw new IllegalArgumentException("Optional arguments must be contiguous: " + method);
                required.add(Unpacker.get(params[i]));
                requiredTypes.add(params[i]);
            }
        }

        Class<?> varargType = varargs ? params[nparams - 1].getComponentType() : null;
        Unpacker varargUnpacker = varargs ? Unpacker.get(varargType) : null;
        Packer packer = Packer.get(method.getReturnType());
        int nreq = required.size();
        int nopt = optional.size();

        method.setAccessible(true);

        return (env, args) -> {
            Object[] jargs = new Object[nparams];
            int j = 0;
            if (passMe)
                jargs[j++] = this;
            if (passEnv)
                jargs[j++] = env;

            int nargs = Pair.length(args);
            if (nargs < nreq || (!rest && !varargs && nargs > nreq + nopt))
                throw new NumArgs(nargs < nreq ? nreq : nreq + nopt, nargs);

            for (int k = 0; k < nreq; k++, j++) {
                Pair p = (Pair)args;
                jargs[j] = required.get(k).apply(requiredTypes.get(k), p.head);
                args = p.tail;
            }

            for (int k = 0; k < nopt; k++, j++) {
                if (args.isPair()) {
                    Pair p = (Pair)args;
                    jargs[j] = Optional.of(optional.get(k).apply(optionalTypes.get(k), p.head));
                    args = p.tail;
                } else {
                    jargs[j] = Optional.empty();
                }
            }

            if (rest) {
                jargs[j] = args;
            } else if (varargs) {
                ImmutableList<LispVal> xs = Pair.toList(args);
                Object array = java.lang.reflect.Array.newInstance(varargType, xs.size());
                for (int k = 0; k < xs.size(); k++) {
                    java.lang.reflect.Array.set(array, k, varargUnpacker.apply(varargType, xs.get(k)));
                }
                jargs[j] = array;
            }

            return packer.apply(invoke(method, jargs));
        };
    }

    private static Class<?> getOptionalType(Type param) {
        if (param instanceof ParameterizedType) {
            ParameterizedType t = (ParameterizedType)param;
            Type[] as = t.getActualTypeArguments();
            if (t.getRawType() == Optional.class && as.length == 1 && as[0] instanceof Class) {
                return (Class<?>)as[0];
            }
        }
        return null;
    }

    private static Object invoke(Method method, Object[] args) {
        try {
            return method.invoke(null, args);
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getTargetException();
            if (cause instanceof LispError)
                throw (LispError)cause;
            if (cause instanceof Error)
                throw (Error)cause;
            throw new LispError(ErrorCode.SIGNATURE_MISMATCH, String.valueOf(cause.getMessage()), cause);
        } catch (IllegalAccessException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
