/*
 * Copyright 2014-2025 Andrew Gaul <andrew@gaul.org>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gaul.ossclient;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String COMMANDS =
            "Commands:\n" +
            "  get KEY [FILE]\n" +
            "  put KEY FILE [CONTENT_TYPE]\n" +
            "  copy SOURCE DEST\n" +
            "  delete KEY...\n" +
            "  head KEY\n" +
            "  list [PREFIX]\n" +
            "  buckets\n" +
            "  presign KEY SECONDS [VERB]";

    private Main() {
        throw new AssertionError("intentionally not implemented");
    }

    private static final class Options {
        @Option(name = "--properties",
                usage = "OssClient configuration (required)")
        private Path properties;

        @Option(name = "--version", usage = "display version")
        private boolean version;

        @Argument(metaVar = "COMMAND", usage = "command and its arguments",
                multiValued = true)
        private List<String> arguments = new ArrayList<>();
    }

    public static void main(String[] args) throws Exception {
        var options = new Options();
        var parser = new CmdLineParser(options);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException cle) {
            usage(parser);
        }

        if (options.version) {
            System.err.println(
                    Main.class.getPackage().getImplementationVersion());
            System.exit(0);
        } else if (options.properties == null ||
                options.arguments.isEmpty()) {
            usage(parser);
        }

        var properties = new Properties();
        try (var is = Files.newInputStream(options.properties)) {
            properties.load(is);
        }
        properties.putAll(System.getProperties());

        int status;
        try (OssClient client = OssClient.Builder.fromProperties(properties)
                .build()) {
            status = run(client, options.arguments, System.out);
        } catch (IllegalArgumentException | IllegalStateException |
                OssException e) {
            logger.debug("command failed", e);
            System.err.println(e.getMessage());
            status = 1;
        }
        System.exit(status);
    }

    /** Execute one command, writing its output to out. */
    static int run(OssClient client, List<String> arguments, PrintStream out)
            throws IOException, OssException {
        checkArgument(!arguments.isEmpty(), "missing command\n%s", COMMANDS);
        String command = arguments.get(0);
        List<String> args = arguments.subList(1, arguments.size());
        switch (command) {
        case "get":
            checkArity(command, args, 1, 2);
            byte[] content = client.get(args.get(0)).getContent();
            if (args.size() == 2) {
                Files.write(Paths.get(args.get(1)), content);
            } else {
                out.write(content);
                out.flush();
            }
            return 0;
        case "put":
            checkArity(command, args, 2, 3);
            var putOptions = PutOptions.builder();
            if (args.size() == 3) {
                putOptions.contentType(args.get(2));
            }
            client.put(Files.readAllBytes(Paths.get(args.get(1))),
                    args.get(0), putOptions.build());
            return 0;
        case "copy":
            checkArity(command, args, 2, 2);
            client.copy(args.get(0), args.get(1));
            return 0;
        case "delete":
            checkArity(command, args, 1, Integer.MAX_VALUE);
            client.deleteMulti(args);
            return 0;
        case "head":
            checkArity(command, args, 1, 1);
            for (Map.Entry<String, String> entry :
                    client.head(args.get(0)).entrySet()) {
                out.println(entry.getKey() + ": " + entry.getValue());
            }
            return 0;
        case "list":
            checkArity(command, args, 0, 1);
            list(client, args.isEmpty() ? null : args.get(0), out);
            return 0;
        case "buckets":
            checkArity(command, args, 0, 0);
            for (BucketSummary bucket : client.listBuckets()) {
                out.println(bucket);
            }
            return 0;
        case "presign":
            checkArity(command, args, 2, 3);
            String verb = args.size() == 3 ? args.get(2) : "GET";
            out.println(client.presignedUrl(verb, args.get(0),
                    Duration.ofSeconds(Long.parseLong(args.get(1)))));
            return 0;
        default:
            throw new IllegalArgumentException("unknown command: " +
                    command + "\n" + COMMANDS);
        }
    }

    private static void list(OssClient client, String prefix,
            PrintStream out) throws OssException {
        var listOptions = ListOptions.builder();
        if (prefix != null) {
            listOptions.prefix(prefix);
        }
        while (true) {
            ListPage page = client.listDetails(listOptions.build());
            for (ObjectSummary summary : page.getEntries()) {
                out.println(summary.getKey());
            }
            if (!page.isTruncated() || page.getNextMarker().isEmpty()) {
                break;
            }
            listOptions.marker(page.getNextMarker());
        }
    }

    private static void checkArity(String command, List<String> args,
            int min, int max) {
        checkArgument(args.size() >= min && args.size() <= max,
                "wrong number of arguments for %s\n%s", command, COMMANDS);
    }

    private static void usage(CmdLineParser parser) {
        System.err.println("Usage: oss-client --properties FILE COMMAND " +
                "[ARGS...]");
        parser.printUsage(System.err);
        System.err.println(COMMANDS);
        System.exit(1);
    }
}
