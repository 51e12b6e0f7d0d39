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

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.assertj.core.api.Fail;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public final class MainTest {
    private static final Clock CLOCK = Clock.fixed(
            Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Rule
    public final TemporaryFolder temporaryFolder = new TemporaryFolder();

    private FakeOssService service;
    private OssClient client;
    private ByteArrayOutputStream output;
    private PrintStream out;

    @Before
    public void setUp() throws Exception {
        service = new FakeOssService("identity", "credential", CLOCK);
        service.createBucket("bucket");
        client = OssClient.builder()
                .endpoint(FakeOssService.HOST)
                .bucket("bucket")
                .credentials("identity", "credential")
                .clock(CLOCK)
                .transport(service)
                .build();
        output = new ByteArrayOutputStream();
        out = new PrintStream(output, true, "UTF-8");
    }

    @Test
    public void testPutAndGet() throws Exception {
        File input = temporaryFolder.newFile("input.txt");
        Files.write(input.toPath(), "file content".getBytes(
                StandardCharsets.UTF_8));

        assertThat(run("put", "key", input.getPath(), "text/plain"))
                .isEqualTo(0);
        assertThat(service.getObject("bucket", "key").contentType)
                .isEqualTo("text/plain");

        assertThat(run("get", "key")).isEqualTo(0);
        assertThat(output()).isEqualTo("file content");

        File copy = new File(temporaryFolder.getRoot(), "copy.txt");
        assertThat(run("get", "key", copy.getPath())).isEqualTo(0);
        assertThat(Files.readAllBytes(copy.toPath())).isEqualTo(
                "file content".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testListFollowsContinuationTokens() throws Exception {
        for (int i = 0; i < 150; ++i) {
            client.put(new byte[0], String.format("key-%03d", i));
        }
        assertThat(run("list")).isEqualTo(0);
        List<String> lines = output().lines()
                .collect(ImmutableList.toImmutableList());
        assertThat(lines).hasSize(150);
        assertThat(lines.get(0)).isEqualTo("key-000");
        assertThat(lines.get(149)).isEqualTo("key-149");
        assertThat(service.getRequests().stream()
                .filter(request -> request.getMethod().equals("GET"))
                .count()).isEqualTo(2);
    }

    @Test
    public void testListPrefix() throws Exception {
        client.put(new byte[0], "a/1");
        client.put(new byte[0], "b/1");
        assertThat(run("list", "a/")).isEqualTo(0);
        assertThat(output().trim()).isEqualTo("a/1");
    }

    @Test
    public void testCopyHeadDelete() throws Exception {
        client.put(new byte[1], "source", PutOptions.builder()
                .userMetadata("owner", "alice")
                .build());
        assertThat(run("copy", "source", "dest")).isEqualTo(0);
        assertThat(run("head", "dest")).isEqualTo(0);
        assertThat(output().trim()).isEqualTo("owner: alice");
        assertThat(run("delete", "source", "dest")).isEqualTo(0);
        assertThat(service.getObject("bucket", "source")).isNull();
        assertThat(service.getObject("bucket", "dest")).isNull();
    }

    @Test
    public void testBuckets() throws Exception {
        service.createBucket("second");
        assertThat(run("buckets")).isEqualTo(0);
        assertThat(output()).contains("bucket").contains("second");
    }

    @Test
    public void testPresign() throws Exception {
        assertThat(run("presign", "key", "60", "PUT")).isEqualTo(0);
        assertThat(output().trim()).startsWith(
                "http://bucket.oss.example.com/key?OSSAccessKeyId=identity" +
                "&Expires=1704067260&Signature=");
    }

    @Test
    public void testUnknownCommand() throws Exception {
        try {
            run("frobnicate");
            Fail.failBecauseExceptionWasNotThrown(
                    IllegalArgumentException.class);
        } catch (IllegalArgumentException iae) {
            assertThat(iae.getMessage()).contains("unknown command");
        }
    }

    @Test
    public void testWrongArity() throws Exception {
        try {
            run("copy", "only-source");
            Fail.failBecauseExceptionWasNotThrown(
                    IllegalArgumentException.class);
        } catch (IllegalArgumentException iae) {
            assertThat(iae.getMessage()).contains("copy");
        }
    }

    @Test
    public void testServiceErrorPropagates() throws Exception {
        try {
            run("get", "missing");
            Fail.failBecauseExceptionWasNotThrown(OssException.class);
        } catch (OssException oe) {
            assertThat(oe.getKind()).isEqualTo(OssErrorKind.GET_ERROR);
        }
    }

    private int run(String... args) throws Exception {
        output.reset();
        return Main.run(client, ImmutableList.copyOf(args), out);
    }

    private String output() {
        out.flush();
        return new String(output.toByteArray(), StandardCharsets.UTF_8);
    }
}
