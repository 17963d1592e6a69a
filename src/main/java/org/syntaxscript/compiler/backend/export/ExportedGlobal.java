package org.syntaxscript.compiler.backend.export;

import java.util.List;

/**
 * An exported global and the descriptors of its exported members.
 *
 * @param name    The global name.
 * @param members The member descriptors in source order.
 */
public record ExportedGlobal(String name, List<ExportedDescriptor> members) implements ExportedDescriptor {

	public ExportedGlobal {
		members = List.copyOf(members);
	}

	@Override
	public ExportType exportType() {
		return ExportType.GLOBAL;
	}
}
