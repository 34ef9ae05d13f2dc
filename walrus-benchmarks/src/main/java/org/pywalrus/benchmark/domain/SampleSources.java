package org.pywalrus.benchmark.domain;

/**
 * Python modules of increasing size used as benchmark input.
 */
public final class SampleSources {

    public static final String PLAIN_MODULE = ""
            + "import re\n"
            + "\n"
            + "\n"
            + "def tokens(text):\n"
            + "    return re.findall(r'\\w+', text)\n";

    public static final String SINGLE_BINDING = ""
            + "while (chunk := stream.read(8192)):\n"
            + "    process(chunk)\n";

    public static final String MIXED_MODULE = ""
            + "import re\n"
            + "\n"
            + "\n"
            + "class Config:\n"
            + "    limit = (__limit := 10) * 2\n"
            + "    if (level := 3) > 1:\n"
            + "        token = (tok := 'abc')\n"
            + "\n"
            + "\n"
            + "def scan(lines):\n"
            + "    total = 0\n"
            + "    for line in lines:\n"
            + "        if (match := re.match(r'(\\d+)', line)) is not None:\n"
            + "            total += int(match.group(1))\n"
            + "    handler = lambda x: (doubled := x * 2) + doubled\n"
            + "    print(f'{total} {(last := total)}')\n"
            + "    return handler(total), last\n"
            + "\n"
            + "\n"
            + "counter = 0\n"
            + "\n"
            + "\n"
            + "def bump():\n"
            + "    global counter\n"
            + "    return (counter := counter + 1)\n";

    private SampleSources() {
    }

    /**
     * {@code copies} renamed copies of {@link #MIXED_MODULE} in one module.
     */
    public static String largeModule(int copies) {
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < copies; i++) {
            source.append(MIXED_MODULE
                    .replace("Config", "Config" + i)
                    .replace("scan", "scan" + i)
                    .replace("bump", "bump" + i));
            source.append("\n\n");
        }
        return source.toString();
    }
}
