package io.hubfetch.download.nodes;

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

import io.hubfetch.api.catalog.CatalogClient;
import io.hubfetch.api.catalog.Checksum;
import io.hubfetch.api.catalog.NodeDescriptor;
import io.hubfetch.api.catalog.ProductDescriptor;
import io.hubfetch.api.errors.DataHubException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Reads the node list of a product package from its `manifest.safe`.
///
/// Each `dataObjectSection/dataObject` entry yields one node:
/// ```xml
/// <dataObject ID="measurement1">
///   <byteStream mimeType="application/octet-stream" size="1024">
///     <fileLocation locatorType="URL" href="./measurement/s1a-iw-grd.tiff"/>
///     <checksum checksumName="MD5">0123456789abcdef0123456789abcdef</checksum>
///   </byteStream>
/// </dataObject>
/// ```
public class ManifestParser {

    private final CatalogClient catalog;

    /// @param catalog the catalog that builds node URLs
    public ManifestParser(CatalogClient catalog) {
        this.catalog = catalog;
    }

    /// @param product the owning product
    /// @param manifest the downloaded manifest file
    /// @return the nodes listed by the manifest, in document order
    /// @throws IOException if the manifest cannot be read
    /// @throws DataHubException if the manifest is malformed
    public List<NodeDescriptor> parse(ProductDescriptor product, Path manifest) throws IOException {
        Document document;
        try (InputStream in = Files.newInputStream(manifest)) {
            document = newBuilder().parse(in);
        } catch (SAXException e) {
            throw new DataHubException("Malformed manifest " + manifest + ": " + e.getMessage(), e);
        }

        List<NodeDescriptor> nodes = new ArrayList<>();
        NodeList sections = document.getElementsByTagNameNS("*", "dataObjectSection");
        for (int s = 0; s < sections.getLength(); s++) {
            for (Element dataObject : children((Element) sections.item(s), "dataObject")) {
                nodes.add(toNode(product, dataObject, manifest));
            }
        }
        return nodes;
    }

    private NodeDescriptor toNode(ProductDescriptor product, Element dataObject, Path manifest) {
        Element byteStream = firstChild(dataObject, "byteStream", manifest);
        Element location = firstChild(byteStream, "fileLocation", manifest);
        String href = location.getAttribute("href");
        if (href.isEmpty()) {
            throw new DataHubException("dataObject " + dataObject.getAttribute("ID") + " in " + manifest + " has no href");
        }

        long size;
        try {
            size = Long.parseLong(byteStream.getAttribute("size").trim());
        } catch (NumberFormatException e) {
            throw new DataHubException("dataObject " + dataObject.getAttribute("ID") + " in " + manifest
                + " has an invalid size: '" + byteStream.getAttribute("size") + "'", e);
        }

        Checksum checksum = null;
        List<Element> checksums = children(byteStream, "checksum");
        if (!checksums.isEmpty()) {
            Element element = checksums.get(0);
            checksum = Checksum.ofHubValues(element.getAttribute("checksumName"), element.getTextContent());
        }

        String relative = href.startsWith("./") ? href.substring(2) : href;
        return new NodeDescriptor(product.id(), href, size, checksum, catalog.nodeUrl(product, relative));
    }

    private static Element firstChild(Element parent, String localName, Path manifest) {
        List<Element> found = children(parent, localName);
        if (found.isEmpty()) {
            throw new DataHubException("Element " + parent.getLocalName() + " in " + manifest + " has no " + localName);
        }
        return found.get(0);
    }

    private static List<Element> children(Element parent, String localName) {
        List<Element> found = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element && localName.equals(child.getLocalName())) {
                found.add((Element) child);
            }
        }
        return found;
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("No usable XML parser", e);
        }
    }
}
