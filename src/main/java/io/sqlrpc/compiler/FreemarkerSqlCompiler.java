package io.sqlrpc.compiler;

import freemarker.core.Environment;
import freemarker.core.InvalidReferenceException;
import freemarker.core.ParseException;
import freemarker.core.TemplateClassResolver;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.TemplateMethodModelEx;
import freemarker.template.TemplateModel;
import freemarker.template.TemplateModelException;
import freemarker.template.TemplateScalarModel;
import freemarker.template.utility.DeepUnwrap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class FreemarkerSqlCompiler implements SqlCompiler {
    private static final Logger LOG = LogManager.getLogger(FreemarkerSqlCompiler.class);

    private final Configuration configuration;

    public FreemarkerSqlCompiler() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        cfg.setAPIBuiltinEnabled(false);
        cfg.setNewBuiltinClassResolver(TemplateClassResolver.ALLOWS_NOTHING_RESOLVER);
        cfg.setNumberFormat("computer");
        cfg.setBooleanFormat("true,false");
        cfg.setLocale(Locale.ROOT);
        this.configuration = cfg;
    }

    @Override
    public CompiledSql compile(SqlSource source, NodeResolver resolver) throws CompilationException {
        RenderContext context = new RenderContext(resolver);
        String rendered;
        try {
            Template main = parse(source.name(), source.rawSql());
            StringWriter out = new StringWriter();
            Environment env = main.createProcessingEnvironment(context.dataModel(), out);
            env.setOut(Writer.nullWriter());
            int index = 0;
            for (String macros : source.macroSources()) {
                if (macros == null || macros.isBlank()) {
                    continue;
                }
                env.include(parse(source.name() + "#macros" + index++, macros));
            }
            env.setOut(out);
            env.process();
            rendered = out.toString();
        } catch (ParseException e) {
            throw new CompilationException(
                    source.description(),
                    "Syntax error at line " + e.getLineNumber() + ", column " + e.getColumnNumber() + ": " + e.getEditorMessage(),
                    e
            );
        } catch (TemplateException e) {
            CompilationException nested = findCompilationCause(e);
            if (nested != null) {
                throw new CompilationException(source.description(), nested.detail(), e);
            }
            throw new CompilationException(source.description(), describe(e), e);
        } catch (IOException e) {
            throw new CompilationException(source.description(), "Template could not be read: " + e.getMessage(), e);
        }
        String compiled = context.ctes.isEmpty() ? rendered : injectCtes(context.ctes, rendered);
        LOG.debug("Compiled {} with {} dependencies", source.name(), context.dependsOn.size());
        return new CompiledSql(source.rawSql(), compiled, List.copyOf(context.dependsOn));
    }

    private Template parse(String name, String text) throws IOException {
        return new Template(name, new StringReader(text), configuration);
    }

    static String injectCtes(Map<String, String> ctes, String sql) {
        StringBuilder sb = new StringBuilder("with ");
        boolean first = true;
        for (Map.Entry<String, String> cte : ctes.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(cte.getKey()).append(" as (\n").append(cte.getValue().strip()).append("\n)");
        }
        String stripped = sql.stripLeading();
        if (stripped.regionMatches(true, 0, "with ", 0, 5)) {
            return sb.append(", ").append(stripped.substring(5).stripLeading()).toString();
        }
        return sb.append(' ').append(stripped).toString();
    }

    private static String describe(TemplateException e) {
        if (e instanceof InvalidReferenceException) {
            String blamed = e.getBlamedExpressionString();
            if (blamed != null && !blamed.isBlank()) {
                return "'" + blamed + "' is undefined";
            }
        }
        String message = e.getMessageWithoutStackTop();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message.strip().lines().findFirst().orElse(message).strip();
    }

    private static CompilationException findCompilationCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof CompilationException) {
                return (CompilationException) current;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String stringArg(List<?> args, int index, String function) throws TemplateModelException {
        if (args.size() <= index) {
            throw new TemplateModelException(function + "() expects at least " + (index + 1) + " argument(s)");
        }
        Object arg = args.get(index);
        if (arg instanceof TemplateScalarModel) {
            return ((TemplateScalarModel) arg).getAsString();
        }
        throw new TemplateModelException(function + "() argument " + (index + 1) + " must be a string");
    }

    private static final class RenderContext {
        private final NodeResolver resolver;
        private final Map<String, String> ctes = new LinkedHashMap<>();
        private final Set<String> dependsOn = new LinkedHashSet<>();

        private RenderContext(NodeResolver resolver) {
            this.resolver = resolver;
        }

        Map<String, Object> dataModel() {
            Map<String, Object> model = new HashMap<>();
            model.put("ref", new RefFunction(this));
            model.put("source", new SourceFunction(this));
            model.put("var", new VarFunction(this));
            return model;
        }

        String record(ResolvedRef ref) {
            dependsOn.add(ref.uniqueId());
            if (ref.ephemeral()) {
                ctes.putIfAbsent(ref.rendered(), ref.cteSql());
            }
            return ref.rendered();
        }
    }

    private static final class RefFunction implements TemplateMethodModelEx {
        private final RenderContext context;

        private RefFunction(RenderContext context) {
            this.context = context;
        }

        @Override
        public Object exec(List arguments) throws TemplateModelException {
            String name = stringArg(arguments, 0, "ref");
            try {
                return context.record(context.resolver.ref(name));
            } catch (CompilationException e) {
                throw new TemplateModelException(e.detail(), e);
            }
        }
    }

    private static final class SourceFunction implements TemplateMethodModelEx {
        private final RenderContext context;

        private SourceFunction(RenderContext context) {
            this.context = context;
        }

        @Override
        public Object exec(List arguments) throws TemplateModelException {
            String sourceName = stringArg(arguments, 0, "source");
            String tableName = stringArg(arguments, 1, "source");
            try {
                return context.record(context.resolver.source(sourceName, tableName));
            } catch (CompilationException e) {
                throw new TemplateModelException(e.detail(), e);
            }
        }
    }

    private static final class VarFunction implements TemplateMethodModelEx {
        private final RenderContext context;

        private VarFunction(RenderContext context) {
            this.context = context;
        }

        @Override
        public Object exec(List arguments) throws TemplateModelException {
            String name = stringArg(arguments, 0, "var");
            Object value = context.resolver.var(name);
            if (value != null) {
                return value;
            }
            if (arguments.size() > 1) {
                return DeepUnwrap.unwrap((TemplateModel) arguments.get(1));
            }
            throw new TemplateModelException("Required var '" + name + "' not found in config");
        }
    }
}
