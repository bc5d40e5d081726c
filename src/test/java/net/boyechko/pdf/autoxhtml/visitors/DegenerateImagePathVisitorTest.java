/*
 * PDF-Auto-XHTML - Tagged PDF to XHTML Conversion
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autoxhtml.visitors;

import static net.boyechko.pdf.autoxhtml.ConversionTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueType;
import net.boyechko.pdf.autoxhtml.validation.NodeTreeWalker;
import org.junit.jupiter.api.Test;

public class DegenerateImagePathVisitorTest {
    private static final String ASSET_FOLDER = "/dataserviceassets/x/images/from-conversion/";

    @Test
    void folderOnlyPathIsReported() {
        IssueList issues =
                new NodeTreeWalker()
                        .addVisitor(new DegenerateImagePathVisitor())
                        .walk(
                                el(
                                        "div",
                                        el("img", attrs("src", ASSET_FOLDER)),
                                        el("img", attrs("src", "/dataserviceassets/x/a.png")),
                                        el("img")));

        assertEquals(2, issues.size());
        assertTrue(issues.stream().allMatch(i -> i.type() == IssueType.DEGENERATE_IMAGE_PATH));
        assertEquals("/div[1]/img[1]", issues.get(0).where().path());
        assertEquals("Image has no file name: ''", issues.get(1).message());
    }
}
