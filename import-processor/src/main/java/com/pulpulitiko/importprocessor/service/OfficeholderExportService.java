package com.pulpulitiko.importprocessor.service;

import com.pulpulitiko.importprocessor.catalog.ReferenceCatalogLoader;
import com.pulpulitiko.importprocessor.reconcile.OfficeholderRegistry;
import com.pulpulitiko.importprocessor.report.ImportTemplateGenerator;
import com.pulpulitiko.importprocessor.report.RegistryExportGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Workbooks built from live reference and registry data.
 */
@Service
@RequiredArgsConstructor
public class OfficeholderExportService {

    private final ReferenceCatalogLoader catalogLoader;
    private final OfficeholderRegistry registry;
    private final RegistryExportGenerator exportGenerator;
    private final ImportTemplateGenerator templateGenerator;

    public byte[] exportCurrentOfficeholders() throws IOException {
        return exportGenerator.generate(registry.listCurrent(), catalogLoader.loadCatalog());
    }

    public byte[] importTemplate() throws IOException {
        return templateGenerator.generate(catalogLoader.loadCatalog());
    }
}
