package org.walletsync.sync.phases;

import org.walletsync.data.wallet.AddressData;
import org.walletsync.event.WalletLog;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncPhase;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Marks addresses with observed history as used.
 */
public class UpdateAddressesPhase implements SyncPhase {

    public static final String NAME = "updateAddresses";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SyncContext execute(SyncContext context) throws DataException {
        Set<String> newlyUsed = new HashSet<>();

        for (AddressData address : context.getAddresses()) {
            if (address.isUsed())
                continue;

            if (!context.getHistoryMap().getOrDefault(address.getAddress(), Collections.emptyList()).isEmpty())
                newlyUsed.add(address.getAddress());
        }

        if (newlyUsed.isEmpty())
            return context;

        Repository repository = context.getRepository();
        int updatedCount = repository.getAddressRepository().markUsed(context.getWalletId(), newlyUsed);
        repository.saveChanges();

        for (AddressData address : context.getAddresses())
            if (newlyUsed.contains(address.getAddress()))
                address.setUsed(true);

        context.getStats().setAddressesUpdated(updatedCount);

        if (updatedCount > 0)
            WalletLog.debug(context.getWalletId(), Category.ADDRESS, String.format("Marked %d address(es) as used", updatedCount));

        return context;
    }
}
