package uitrace.capture;

import uitrace.ledger.Ledger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File layout of an output directory:
 * <pre>
 * {out}/collected_data.json
 * {out}/image/elem_{id}_raw.png | _boxed.png | _dest.png
 * {out}/image/final_screenshot.png
 * {out}/element_xml/elem_{id}.xml | _dest.xml
 * </pre>
 */
public class CaptureLayout {

    private final Path root;
    private final Path imageDir;
    private final Path xmlDir;

    public CaptureLayout(Path root) {
        this.root     = root.toAbsolutePath().normalize();
        this.imageDir = this.root.resolve("image");
        this.xmlDir   = this.root.resolve("element_xml");
    }

    public void ensureDirectories() throws IOException {
        Files.createDirectories(imageDir);
        Files.createDirectories(xmlDir);
    }

    public static String elemId(int sequenceId) {
        return "elem_" + sequenceId;
    }

    public Path root()                     { return root; }
    public Path ledgerFile()               { return root.resolve(Ledger.FILE_NAME); }
    public Path preXml(int id)             { return xmlDir.resolve(elemId(id) + ".xml"); }
    public Path postXml(int id)            { return xmlDir.resolve(elemId(id) + "_dest.xml"); }
    public Path rawImage(int id)           { return imageDir.resolve(elemId(id) + "_raw.png"); }
    public Path boxedImage(int id)         { return imageDir.resolve(elemId(id) + "_boxed.png"); }
    public Path postImage(int id)          { return imageDir.resolve(elemId(id) + "_dest.png"); }
    public Path exitScreenshot()           { return imageDir.resolve("final_screenshot.png"); }
}
