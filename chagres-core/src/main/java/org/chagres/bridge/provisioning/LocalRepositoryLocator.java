package org.chagres.bridge.provisioning;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Finds the local Maven repository.
 *
 * <p>Detection order: the {@code maven.repo.local} system property, {@code localRepository} in the
 * user's {@code ~/.m2/settings.xml}, then {@code ~/.m2/repository}.
 */
public final class LocalRepositoryLocator {
  private static final Logger LOG = Logger.getLogger(LocalRepositoryLocator.class.getName());

  private LocalRepositoryLocator() {}

  public static Path findLocalRepository() {
    String userHome = System.getProperty("user.home");
    return fromSystemProperty()
        .or(() -> fromSettings(m2Home(userHome).resolve("settings.xml"), userHome))
        .orElse(m2Home(userHome).resolve("repository"));
  }

  private static Optional<Path> fromSystemProperty() {
    String value = System.getProperty("maven.repo.local");
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(Path.of(value));
  }

  /** {@code localRepository} from a Maven settings file, if it declares one. */
  static Optional<Path> fromSettings(Path settings, String userHome) {
    if (!Files.isRegularFile(settings)) {
      return Optional.empty();
    }
    try {
      DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
      dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
      Document doc = dbf.newDocumentBuilder().parse(settings.toFile());
      NodeList nodes = doc.getElementsByTagName("localRepository");
      if (nodes.getLength() > 0) {
        String value = nodes.item(0).getTextContent().trim();
        if (!value.isEmpty()) {
          return Optional.of(Path.of(expandPath(value, userHome)));
        }
      }
    } catch (ParserConfigurationException | SAXException | IOException e) {
      LOG.warning("Ignoring unreadable Maven settings " + settings + ": " + e.getMessage());
    }
    return Optional.empty();
  }

  private static Path m2Home(String userHome) {
    return Path.of(userHome, ".m2");
  }

  // Leading ~ and ${user.home}
  static String expandPath(String path, String userHome) {
    if (path.equals("~") || path.startsWith("~/") || path.startsWith("~" + File.separator)) {
      path = userHome + path.substring(1);
    }
    return path.replace("${user.home}", userHome);
  }
}
