package com.pgm.xdsl;

import com.pgm.xdsl.api.ConversionException;
import com.pgm.xdsl.codegen.GeneratorTarget;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line runner.
 *
 * <pre>
 * XdslConverterMain &lt;input.xdsl&gt; [output-file] [--target=pyagrum|mermaid|json] [--strict]
 * </pre>
 *
 * Without an output file the generated text is printed to stdout.
 */
@Log4j2
public class XdslConverterMain {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        String input = null;
        String output = null;
        GeneratorTarget target = GeneratorTarget.PYAGRUM;
        boolean strict = false;

        for (String arg : args) {
            if (arg.startsWith("--target=")) {
                try {
                    target = GeneratorTarget.fromString(arg.substring("--target=".length()));
                } catch (IllegalArgumentException e) {
                    log.error(e.getMessage());
                    return 2;
                }
            } else if (arg.equals("--strict")) {
                strict = true;
            } else if (input == null) {
                input = arg;
            } else if (output == null) {
                output = arg;
            } else {
                log.error("Unexpected argument: {}", arg);
                return 2;
            }
        }
        if (input == null) {
            log.error("Usage: XdslConverterMain <input.xdsl> [output-file] [--target=pyagrum|mermaid|json] [--strict]");
            return 2;
        }

        try {
            var converter = new XdslConverter(target).strictTableShapes(strict);
            converter.parse(input);
            String code = converter.generateCode();
            if (output == null) {
                System.out.println(code);
            } else {
                Files.writeString(Path.of(output), code);
                log.info("Generated {} code saved to {}", target, output);
            }
            return 0;
        } catch (ConversionException | NumberFormatException e) {
            log.error("Conversion of {} failed: {}", input, e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to write {}", output, e);
            return 1;
        }
    }
}
