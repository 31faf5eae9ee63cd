package io.hubfetch.download;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.nio.charset.StandardCharsets;

/// Builds `manifest.safe` documents for tests.
final class Manifests {

    private final StringBuilder objects = new StringBuilder();

    Manifests node(String id, String href, byte[] content) {
        return node(id, href, content.length, "MD5", FakeCatalog.md5(content));
    }

    Manifests node(String id, String href, long size, String checksumName, String checksum) {
        objects.append("    <dataObject ID=\"").append(id).append("\" repID=\"s1Level1MeasurementSchema\">\n")
            .append("      <byteStream mimeType=\"application/octet-stream\" size=\"").append(size).append("\">\n")
            .append("        <fileLocation locatorType=\"URL\" href=\"").append(href).append("\"/>\n");
        if (checksumName != null) {
            objects.append("        <checksum checksumName=\"").append(checksumName).append("\">")
                .append(checksum).append("</checksum>\n");
        }
        objects.append("      </byteStream>\n")
            .append("    </dataObject>\n");
        return this;
    }

    String xml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<xfdu:XFDU xmlns:xfdu=\"urn:ccsds:schema:xfdu:1\" version=\"esa/safe/sentinel-1.0/sentinel-1/sar/level-1/slc\">\n"
            + "  <metadataSection/>\n"
            + "  <dataObjectSection>\n"
            + objects
            + "  </dataObjectSection>\n"
            + "</xfdu:XFDU>\n";
    }

    byte[] bytes() {
        return xml().getBytes(StandardCharsets.UTF_8);
    }
}
