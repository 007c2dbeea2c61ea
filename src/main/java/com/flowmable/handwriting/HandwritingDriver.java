package com.flowmable.handwriting;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line driver: analyze a sample image, print its style as JSON, and
 * render text in that style as SVG.
 *
 * <pre>
 * HandwritingDriver &lt;sample-image&gt; &lt;text&gt; [--seed N] [--config file] [--svg out.svg]
 * </pre>
 */
public class HandwritingDriver {

    private static final String USAGE =
            "Usage: HandwritingDriver <sample-image> <text> [--seed N] [--config file] [--svg out.svg]";

    static final int EXIT_USAGE = 2;

    public static void main(String[] args) throws Exception {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** @return process exit status */
    static int run(String[] args) throws IOException {
        if (args.length < 2) {
            return usage(null);
        }
        Path sample = Path.of(args[0]);
        String text = args[1];
        Long seed = null;
        Path config = null;
        Path svgOut = null;
        for (int i = 2; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                return usage("Missing value for " + flag);
            }
            String value = args[++i];
            switch (flag) {
                case "--seed":
                    try {
                        seed = Long.parseLong(value);
                    } catch (NumberFormatException e) {
                        return usage("Seed must be an integer: " + value);
                    }
                    break;
                case "--config":
                    config = Path.of(value);
                    break;
                case "--svg":
                    svgOut = Path.of(value);
                    break;
                default:
                    return usage("Unknown option " + flag);
            }
        }

        SettingsLoader.Settings settings;
        try {
            settings = config != null ? SettingsLoader.load(config) : SettingsLoader.loadDefault();
        } catch (InvalidInputException e) {
            return usage("Invalid configuration: " + e.getMessage());
        }
        RenderSettings render = seed != null ? settings.render().withSeed(seed) : settings.render();
        HandwritingSynthesizer synthesizer = new HandwritingSynthesizer(settings.analysis(), render);

        StyleDescriptor style;
        try {
            style = synthesizer.analyze(sample);
        } catch (IOException e) {
            System.err.println("Could not decode " + sample + ": " + e.getMessage());
            System.err.println("Proceeding with the default style.");
            style = synthesizer.defaultStyle();
        }

        System.out.println("=== Style ===");
        System.out.println(StyleDescriptorJson.toJson(style));

        RenderedDocument document = synthesizer.generate(style, text);
        System.out.println("=== Layout ===");
        System.out.println("Glyphs:    " + document.placements().size());
        System.out.println("Truncated: " + document.truncated());
        System.out.println("Seed:      " + document.seed());

        String svg = SvgStrokeSink.toSvg(document);
        if (svgOut != null) {
            Files.writeString(svgOut, svg, StandardCharsets.UTF_8);
            System.out.println("SVG written to " + svgOut);
        } else {
            System.out.println(svg);
        }
        return 0;
    }

    private static int usage(String problem) {
        if (problem != null) {
            System.err.println(problem);
        }
        System.err.println(USAGE);
        return EXIT_USAGE;
    }
}
