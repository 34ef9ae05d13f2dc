package org.pywalrus;

import org.pywalrus.parser.SourceParser;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.util.AstUtils;
import org.pywalrus.transpiler.ConversionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Back-ports Python assignment expressions ({@code name := value}) to code that runs on
 * grammars without them.
 * <pre>{@code
 * String converted = Walrus.convert(source, ConversionConfig.builder().detectFrom(source).build());
 * }</pre>
 * Source without assignment expressions is returned unchanged. Each call is independent,
 * so different sources may be converted on different threads at the same time.
 */
public final class Walrus {

    private static final Logger LOG = LoggerFactory.getLogger(Walrus.class);

    private Walrus() {
    }

    public static String convert(String source) {
        return convert(source, ConversionConfig.defaults());
    }

    public static String convert(String source, ConversionConfig config) {
        return convert(source, SourceParser.DEFAULT_SOURCE_NAME, config);
    }

    /**
     * @param sourceName name used in error messages, usually the file name
     * @throws WalrusSyntaxException  if the source is not valid for the configured version,
     *                                including assignment expressions in illegal positions
     * @throws WalrusContextException if the conversion cannot be completed
     */
    public static String convert(String source, String sourceName, ConversionConfig config) {
        Node module = SourceParser.parse(source, sourceName, config.getSourceVersion());
        if (!AstUtils.containsNamedExpr(module)) {
            LOG.debug("No assignment expressions in {}", sourceName);
            return source;
        }
        ConversionContext context = ConversionContext.forModule(module, config, config.newNameGenerator());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Converted {} assignment expressions in {}", AstUtils.countNamedExprs(module), sourceName);
        }
        return context.getOutput();
    }
}
