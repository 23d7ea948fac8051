package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.interfaces.IPrefixResolver;
import io.mersel.services.yin.application.models.ModuleImport;
import io.mersel.services.yin.application.models.SchemaModule;
import io.mersel.services.yin.application.models.SubmoduleInclude;
import org.springframework.stereotype.Component;

/**
 * {@code import} tablolarına dayalı önek çözümleyici.
 * <p>
 * İki modül aynı ana modüle aitse (modül ve alt modülleri) önek gerekmez. Aksi halde
 * önce referans veren modülün kendi içe aktarımlarına, sonra dahil ettiği alt modüllerin
 * içe aktarımlarına bakılır; ilk eşleşmenin öneki döner.
 */
@Component
public class ImportPrefixResolver implements IPrefixResolver {

    @Override
    public String resolve(SchemaModule referencingModule, SchemaModule definingModule)
            throws PrefixResolutionException {
        return resolve(referencingModule, definingModule.mainModule().getName());
    }

    @Override
    public String resolve(SchemaModule referencingModule, String definingModuleName)
            throws PrefixResolutionException {
        if (referencingModule.mainModule().getName().equals(definingModuleName)) {
            return "";
        }

        String prefix = findImportPrefix(referencingModule, definingModuleName);
        if (prefix != null) {
            return prefix;
        }

        // Alt modüllerin içe aktarımları
        for (SubmoduleInclude include : referencingModule.getIncludes()) {
            prefix = findImportPrefix(include.submodule(), definingModuleName);
            if (prefix != null) {
                return prefix;
            }
        }

        throw new PrefixResolutionException(
                referencingModule + " içinde \"" + definingModuleName
                        + "\" modülüne ait bir import bulunamadı; önek çözümlenemiyor");
    }

    private static String findImportPrefix(SchemaModule module, String moduleName) {
        for (ModuleImport moduleImport : module.getImports()) {
            if (moduleImport.module().getName().equals(moduleName)) {
                return moduleImport.prefix();
            }
        }
        return null;
    }
}
