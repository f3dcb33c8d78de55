/*
 * Copyright (C) 2024 University of Dundee & Open Microscopy Environment.
 * All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package org.openmicroscopy.ms.depth;

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Check the table schema computed for image rows.
 * @author The Open Microscopy Environment
 */
public class TableSchemaTest {

    /**
     * Check the order, names and types of the columns.
     * @throws ImageServiceException unexpected
     */
    @Test
    public void testColumns() throws ImageServiceException {
        final TableSchema schema = TableSchema.forRows(ImmutableList.of(new ImageRow("core", 0, 1.0, 1, new int[] {1, 2, 3})));
        final List<String> names = schema.getColumns().stream().map(TableSchema.Column::getName).collect(Collectors.toList());
        Assertions.assertEquals(ImmutableList.of("row_index", "0", "1", "2", "channels", "depth", "image_name"), names);
        final List<TableSchema.ColumnType> types =
                schema.getColumns().stream().map(TableSchema.Column::getType).collect(Collectors.toList());
        Assertions.assertEquals(TableSchema.ColumnType.FLOAT, types.get(5));
        Assertions.assertEquals(TableSchema.ColumnType.TEXT, types.get(6));
        Assertions.assertTrue(types.subList(0, 5).stream().allMatch(TableSchema.ColumnType.INTEGER::equals));
        Assertions.assertTrue(schema.hasColumn(TableSchema.COLUMN_IMAGE_NAME));
        Assertions.assertFalse(schema.hasColumn("3"));
    }

    /**
     * Check that the tag columns are distinguished from the pixel columns.
     */
    @Test
    public void testTagColumns() {
        Assertions.assertTrue(TableSchema.isTagColumn("depth"));
        Assertions.assertTrue(TableSchema.isTagColumn("IMAGE_NAME"));
        Assertions.assertFalse(TableSchema.isTagColumn("0"));
    }

    /**
     * Check that rows of differing length have no schema.
     */
    @Test
    public void testMismatch() {
        final List<ImageRow> rows = ImmutableList.of(
                new ImageRow("core", 0, 1.0, 1, new int[] {1, 2}),
                new ImageRow("core", 1, 2.0, 1, new int[] {1}));
        final ImageServiceException exception =
                Assertions.assertThrows(ImageServiceException.class, () -> TableSchema.forRows(rows));
        Assertions.assertEquals(ImageServiceException.Kind.CONVERSION, exception.getKind());
    }
}
